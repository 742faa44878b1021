package com.lbg.markets.surveillance.pipeline;

import com.lbg.markets.surveillance.pipeline.domain.FileTask;
import com.lbg.markets.surveillance.pipeline.domain.VerificationReport;
import com.lbg.markets.surveillance.pipeline.orchestration.PipelineException;
import com.lbg.markets.surveillance.pipeline.orchestration.PipelineOrchestrator;
import com.lbg.markets.surveillance.pipeline.source.TaskCatalog;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.List;

/**
 * Command-line entry point: load the catalog, run it, exit 0 only if every file made it.
 * An optional first argument overrides {@code pipeline.catalog}.
 * <p>
 * Exit codes: 0 clean, 1 failed or missing files, 2 unusable catalog, 3 run aborted.
 */
@QuarkusMain
public class PipelineApplication implements QuarkusApplication {

    private static final Logger LOG = Logger.getLogger(PipelineApplication.class);

    static final int EXIT_CLEAN = 0;
    static final int EXIT_INCOMPLETE = 1;
    static final int EXIT_INVALID_CATALOG = 2;
    static final int EXIT_ABORTED = 3;

    @Inject
    TaskCatalog catalog;

    @Inject
    PipelineOrchestrator orchestrator;

    @ConfigProperty(name = "pipeline.catalog", defaultValue = "tasks.json")
    String catalogLocation;

    public static void main(String... args) {
        Quarkus.run(PipelineApplication.class, args);
    }

    @Override
    public int run(String... args) {
        String location = args.length > 0 ? args[0] : catalogLocation;

        List<FileTask> tasks;
        try {
            tasks = catalog.load(location);
        } catch (IOException | IllegalArgumentException e) {
            LOG.errorf(e, "Could not load catalog %s", location);
            return EXIT_INVALID_CATALOG;
        }

        VerificationReport report;
        try {
            report = orchestrator.executeRun(tasks);
        } catch (IllegalArgumentException e) {
            LOG.errorf(e, "Catalog %s is not a valid batch", location);
            return EXIT_INVALID_CATALOG;
        } catch (PipelineException e) {
            LOG.errorf(e, "Pipeline run for %s aborted", location);
            return EXIT_ABORTED;
        }
        return report.isClean() ? EXIT_CLEAN : EXIT_INCOMPLETE;
    }
}
