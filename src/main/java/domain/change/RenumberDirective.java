package domain.change;

/**
 * Moves every article whose order lies in {@code [beginOrd, endOrd]} down by {@code shiftOrd}.
 */
public final class RenumberDirective {

    /**
     * Upper bound of a directive that names no upper bound.
     */
    public static final int OPEN_END = 1000;

    private final int beginOrd;
    private final int endOrd;
    private final int shiftOrd;
    private final boolean openEnded;

    public RenumberDirective(int beginOrd, int endOrd, int shiftOrd) {
        this(beginOrd, endOrd, shiftOrd, false);
    }

    private RenumberDirective(int beginOrd, int endOrd, int shiftOrd, boolean openEnded) {
        this.beginOrd = beginOrd;
        this.endOrd = endOrd;
        this.shiftOrd = shiftOrd;
        this.openEnded = openEnded;
    }

    /**
     * Directive without an upper bound; {@link #getEndOrd()} reports {@link #OPEN_END}
     * until it is closed. An explicit {@code <= 1000} range is not open-ended.
     */
    public static RenumberDirective openEnded(int beginOrd, int shiftOrd) {
        return new RenumberDirective(beginOrd, OPEN_END, shiftOrd, true);
    }

    public int getBeginOrd() {
        return beginOrd;
    }

    public int getEndOrd() {
        return endOrd;
    }

    public int getShiftOrd() {
        return shiftOrd;
    }

    public boolean isOpenEnded() {
        return openEnded;
    }

    public RenumberDirective closedAt(int newEndOrd) {
        return new RenumberDirective(beginOrd, newEndOrd, shiftOrd);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RenumberDirective)) return false;
        RenumberDirective that = (RenumberDirective) o;
        return beginOrd == that.beginOrd && endOrd == that.endOrd && shiftOrd == that.shiftOrd
                && openEnded == that.openEnded;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * beginOrd + endOrd) + shiftOrd) + (openEnded ? 1 : 0);
    }

    @Override
    public String toString() {
        return "RenumberDirective{begin=" + beginOrd
                + ", end=" + (isOpenEnded() ? "open" : String.valueOf(endOrd))
                + ", shift=" + shiftOrd + '}';
    }
}
