package com.largomodo.rawconvert;

import com.largomodo.rawconvert.core.*;
import com.largomodo.rawconvert.core.event.EventChannel;
import com.largomodo.rawconvert.service.DecoderType;
import com.largomodo.rawconvert.service.DefaultConversionFacade;
import com.largomodo.rawconvert.service.JpegImageEncoder;
import com.largomodo.rawconvert.service.RawDecoder;
import com.largomodo.rawconvert.util.RawFileMatcher;
import com.largomodo.rawconvert.util.SourceFileLister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * CLI entry point for raw camera image to JPEG conversion.
 * <p>
 * Uses Picocli framework for argument parsing with automatic help generation
 * and type-safe validation. Accepts a single positional input path: a directory is
 * converted as a batch of all raw files directly inside it, a single raw file as a
 * batch of one.
 * <p>
 * Smart defaults:
 * - File input without -o: outputs to current working directory
 * - Directory input without -o: outputs to <input>/output subdirectory
 * - Explicit -o flag: overrides all defaults
 * <p>
 * The batch runs on its own scheduler thread; this command only consumes the event
 * stream. Ctrl+C is the abort button: it cancels the run and waits for its final status.
 */
@Command(
        name = "rawconvert",
        mixinStandardHelpOptions = true,
        resourceBundle = "rawconvert.rawconvert",
        version = "${bundle:application.version}",
        header = "Converts raw camera images (NEF, CR2, ARW, DNG, ...) to JPEG.",
        description = {
                "Decodes every raw file of the input directory and writes a JPEG with the same base name" +
                        " to the output directory, using a fixed number of worker threads.",
                "",
                "Raw decoding uses 'dcraw' by default. Press Ctrl+C to abort a running batch:" +
                        " files already being converted are finished, the rest are skipped."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:All files converted",
                "1:Some files failed, the batch was aborted, or an I/O error occurred",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "dcraw(1)"
        }
)
public class RawConvert implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RawConvert.class);

    // Bounded wait of the Ctrl+C handler for in-flight files to finish
    private static final long ABORT_WAIT_SECONDS = 30;

    @Parameters(index = "0", paramLabel = "INPUT",
            description = {
                    "Directory containing raw files, or a single raw file.",
                    "Only files directly inside the directory are converted (no recursion)."
            })
    File inputPath;

    @Option(names = {"-o", "--output-dir"},
            description = {
                    "Destination directory for JPEG files.",
                    "If omitted, defaults apply:",
                    "  - Single file input: Defaults to the current directory ('.').",
                    "  - Directory input: Defaults to a folder named 'output' inside the input directory.",
                    "The directory is created if missing."
            })
    File outputDir;

    @Option(names = {"-q", "--quality"}, defaultValue = "" + RunConfiguration.DEFAULT_QUALITY,
            description = "JPEG quality, 1-100. Default: ${DEFAULT-VALUE}")
    int quality;

    @Option(names = {"-t", "--threads"}, defaultValue = "" + RunConfiguration.DEFAULT_WORKER_COUNT,
            description = "Number of files converted concurrently. Default: ${DEFAULT-VALUE}")
    int threads;

    @Option(names = "--resize",
            description = "Scale every output image to exactly --width x --height pixels.")
    boolean resize;

    @Option(names = "--width", defaultValue = "" + RunConfiguration.DEFAULT_WIDTH,
            description = "Output width when resizing. Default: ${DEFAULT-VALUE}")
    int width;

    @Option(names = "--height", defaultValue = "" + RunConfiguration.DEFAULT_HEIGHT,
            description = "Output height when resizing. Default: ${DEFAULT-VALUE}")
    int height;

    @Option(names = "--decoder", defaultValue = "DCRAW",
            description = {
                    "Raw decoding backend.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    DecoderType decoder;

    @Option(names = "--dcraw-path", defaultValue = "dcraw",
            description = "Path to dcraw binary (default: ${DEFAULT-VALUE})")
    String dcrawPath;

    @Option(names = "--preview", paramLabel = "FILE",
            description = "Keep the preview of the most recently decoded file in this JPEG file.")
    File previewFile;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new RawConvert());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (!inputPath.exists()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path does not exist: " + inputPath.getAbsolutePath());
        }

        if (!inputPath.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path is not readable (check permissions): " + inputPath.getAbsolutePath());
        }

        if (inputPath.isFile() && !RawFileMatcher.hasRawExtension(inputPath.getName())) {
            throw new ParameterException(spec.commandLine(),
                    "Input file is not a recognized raw format: " + inputPath.getAbsolutePath());
        }

        if (outputDir == null) {
            if (inputPath.isFile()) {
                outputDir = new File(".");
            } else {
                outputDir = new File(inputPath, "output");
            }
        }

        if (outputDir.exists() && !outputDir.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
        }
        if (outputDir.exists() && !outputDir.canWrite()) {
            throw new ParameterException(spec.commandLine(),
                    "Output directory is not writable (check permissions): " + outputDir.getAbsolutePath());
        }

        Path inputDir = inputPath.isFile()
                ? inputPath.getAbsoluteFile().getParentFile().toPath()
                : inputPath.getAbsoluteFile().toPath();

        RunConfiguration config;
        try {
            config = new RunConfiguration(inputDir, outputDir.getAbsoluteFile().toPath(),
                    quality, resize, width, height, threads);
        } catch (ConfigurationException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }

        if (decoder.requiresExternalTool()) {
            validateExternalTools();
        }

        Files.createDirectories(config.outputDir());

        List<WorkItem> items = inputPath.isFile()
                ? List.of(new WorkItem(inputPath.getName()))
                : SourceFileLister.list(config.inputDir());

        return runBatch(config, items);
    }

    /**
     * Execute the batch and render its events until the terminal status.
     * <p>
     * Wiring: decoder + JPEG encoder behind the conversion facade, one processor shared by
     * all workers, one event channel with this command's observer as its subscriber.
     *
     * @return exit code: 0 when every file converted, 1 on any file error or abort
     */
    private int runBatch(RunConfiguration config, List<WorkItem> items) throws InterruptedException {
        // Dependency injection: instantiate service implementations
        RawDecoder rawDecoder = decoder.create(dcrawPath);
        ConversionFacade facade = new DefaultConversionFacade(rawDecoder, new JpegImageEncoder());
        BatchScheduler scheduler = new BatchScheduler(new WorkItemProcessor(facade));

        ConsoleEventObserver observer = new ConsoleEventObserver(
                previewFile == null ? null : previewFile.getAbsoluteFile().toPath());

        try (EventChannel channel = new EventChannel()) {
            channel.subscribe(observer);

            log.info("Starting conversion...");
            BatchRun batchRun = scheduler.start(items, config, channel);

            // Shutdown hook for graceful SIGINT handling: Ctrl+C is the abort trigger
            Thread abortHook = new Thread(() -> {
                if (!batchRun.isDone()) {
                    log.info("Interrupt received, aborting...");
                    batchRun.abort();
                    try {
                        if (!batchRun.await(ABORT_WAIT_SECONDS, TimeUnit.SECONDS)) {
                            log.warn("Batch did not stop within {}s", ABORT_WAIT_SECONDS);
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    channel.close();
                }
            }, "rawconvert-abort");
            Runtime.getRuntime().addShutdownHook(abortHook);

            try {
                batchRun.await();
            } finally {
                removeShutdownHook(abortHook);
            }
        }

        if (observer.errorCount() > 0) {
            log.info("{} error(s) reported, see messages above", observer.errorCount());
        }
        return observer.errorCount() == 0 && !observer.aborted() ? 0 : 1;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down: the hook is running and owns the abort
            log.debug("Shutdown in progress, abort hook left in place");
        }
    }

    /**
     * Check if command exists in system PATH.
     */
    private static boolean commandExistsInPath(String command) {
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null || pathEnv.isEmpty()) {
            return false;  // Fail-fast validation will catch missing tools
        }
        return Arrays.stream(pathEnv.split(File.pathSeparator))
                .map(dir -> new File(dir, command))
                .anyMatch(File::canExecute);
    }

    /**
     * Validate external tool availability (dcraw).
     * Fail-fast validation prevents a batch where every file fails the same way.
     */
    private void validateExternalTools() throws IOException {
        File dcraw = new File(dcrawPath);
        if (!dcraw.canExecute() && !commandExistsInPath(dcrawPath)) {
            throw new IOException("dcraw not found: install via package manager, specify --dcraw-path,"
                    + " or use --decoder imageio");
        }
    }
}
