package org.databaseclone.cli;

import org.databaseclone.clone.worker.CloneProgressListener;

import lombok.extern.slf4j.Slf4j;

/**
 * Logs clone progress.  Collection level phases log every item; the document write phase logs
 * every {@code documentInterval} documents and the last one.
 */
@Slf4j
public class LoggingProgressListener implements CloneProgressListener {
    public static final int DEFAULT_DOCUMENT_INTERVAL = 100;

    private final int documentInterval;

    public LoggingProgressListener() {
        this(DEFAULT_DOCUMENT_INTERVAL);
    }

    public LoggingProgressListener(int documentInterval) {
        this.documentInterval = Math.max(1, documentInterval);
    }

    @Override
    public void phaseStarted(Phase phase, int total) {
        log.atInfo().setMessage("{}: starting, {} item(s)").addArgument(phase).addArgument(total).log();
    }

    @Override
    public void itemCompleted(Phase phase, String name, boolean success, int done, int total) {
        if (phase == Phase.WRITE) {
            if (done % documentInterval == 0 || done == total) {
                log.atInfo().setMessage("{}: {}/{} documents").addArgument(phase).addArgument(done).addArgument(total).log();
            }
            if (!success) {
                log.atDebug().setMessage("{}: document {} of {} failed").addArgument(phase).addArgument(done).addArgument(name).log();
            }
            return;
        }
        log.atInfo().setMessage("{}: [{}/{}] {} {}")
            .addArgument(phase)
            .addArgument(done)
            .addArgument(total)
            .addArgument(name)
            .addArgument(success ? "done" : "FAILED")
            .log();
    }

    @Override
    public void phaseCompleted(Phase phase) {
        log.atInfo().setMessage("{}: complete").addArgument(phase).log();
    }
}
