package de.bsommerfeld.mindshare.pipeline;

/**
 * Thrown when a run fails after configuration has loaded. The {@link Stage}
 * tells the entry point which exit code to report.
 */
public class PipelineException extends Exception {

    public enum Stage {
        CONNECTION(2),
        AGGREGATION(3),
        STORE_WRITE(4),
        EXPORT_WRITE(5);

        private final int exitCode;

        Stage(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }

    private final Stage stage;

    public PipelineException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
