package cli;

import app.ArticleChangeCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>Orchestration lives in {@link ArticleChangeCliApp}; this class only carries the
 * jar's main entry.</p>
 */
public class ArticleChangeCli {

    public static void main(String[] args) {
        int code = ArticleChangeCliApp.run(args);
        if (code != 0) System.exit(code);
    }
}
