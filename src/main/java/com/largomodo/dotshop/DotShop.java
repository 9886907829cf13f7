package com.largomodo.dotshop;

import com.largomodo.dotshop.core.ModulationException;
import com.largomodo.dotshop.core.ScreenProfile;
import com.largomodo.dotshop.emit.EmissionRequest;
import com.largomodo.dotshop.emit.EmissionResult;
import com.largomodo.dotshop.profile.ScreenProfileLoader;
import com.largomodo.dotshop.quantize.DitherAlgorithm;
import com.largomodo.dotshop.quantize.QuantizerOptions;
import com.largomodo.dotshop.sequence.CancellationSignal;
import com.largomodo.dotshop.sequence.SequenceObserver;
import com.largomodo.dotshop.sequence.SequencerOptions;
import com.largomodo.dotshop.service.ConversionJob;
import com.largomodo.dotshop.service.ImageIoFrameSource;
import com.largomodo.dotshop.util.IdentifierUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * CLI entry point converting an image or animated GIF into display bitmap source code.
 * <p>
 * Options are declared with picocli annotations. Values that fail validation are reported
 * as usage errors (exit code 2) before the input is opened. The generated code goes to the
 * file given with -o, or to standard output; log output always goes to standard error.
 */
@Command(
        name = "dotshop",
        mixinStandardHelpOptions = true,
        resourceBundle = "dotshop.dotshop",
        version = "${bundle:application.version}",
        header = "Converts images into packed bitmap source code for embedded displays.",
        description = {
                "Quantizes a still image or animated GIF to a screen profile's color mode, packs it in the" +
                        " display's scan order and emits the bytes as C, Arduino, Python or JavaScript source.",
                "",
                "Profiles are given as a built-in id (see --list-profiles) or a JSON file."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, corrupt input, etc.)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class DotShop implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DotShop.class);

    @Parameters(index = "0", arity = "0..1", paramLabel = "INPUT",
            description = "The source image (.png, .bmp, .jpg, .gif). Animated GIFs produce one buffer per frame.")
    File inputPath;

    @Option(names = {"-p", "--profile"}, paramLabel = "PROFILE",
            description = "Built-in screen profile id or path to a profile JSON file.")
    String profile;

    @Option(names = {"-o", "--output"},
            description = "Destination file for the generated code. If omitted, the code is written to standard output.")
    File outputFile;

    @Option(names = {"-t", "--target"}, defaultValue = EmissionRequest.DEFAULT_TARGET,
            description = {"Target language: c, arduino, python, javascript.", "Default: ${DEFAULT-VALUE}"})
    String target;

    @Option(names = {"-s", "--symbol"},
            description = "Base name of the emitted arrays. Default: derived from the input file name.")
    String symbol;

    @Option(names = "--dither", defaultValue = "THRESHOLD",
            description = {"Monochrome dithering.", "Valid values: ${COMPLETION-CANDIDATES}", "Default: ${DEFAULT-VALUE}"})
    DitherAlgorithm dither;

    @Option(names = "--threshold", defaultValue = "128",
            description = "Luminance (0-255) at or above which a mono pixel is on. Default: ${DEFAULT-VALUE}")
    int threshold;

    @Option(names = "--seed", description = "Seed for --dither RANDOM (required with it).")
    Long seed;

    @Option(names = "--invert", description = "Invert mono output for displays whose lit state is 0.")
    boolean invert;

    @Option(names = "--background", defaultValue = "000000",
            description = "Hex RGB color transparent pixels are blended against. Default: ${DEFAULT-VALUE}")
    String background;

    @Option(names = "--transform", paramLabel = "NAME",
            description = "Byte transform applied after packing (invert, reverse-bits). Repeatable; applied in order.")
    List<String> transforms = new ArrayList<>();

    @Option(names = "--look-ahead", defaultValue = "1",
            description = "Frames in flight between source and output. Default: ${DEFAULT-VALUE}")
    int lookAhead;

    @Option(names = "--workers", defaultValue = "1",
            description = "Worker threads encoding frames. Default: ${DEFAULT-VALUE}")
    int workers;

    @Option(names = "--corruption-tolerance", defaultValue = "0.10",
            description = "Maximum share of corrupt frames skipped before failing. Default: ${DEFAULT-VALUE}")
    double corruptionTolerance;

    @Option(names = "--line-wrap", defaultValue = "100",
            description = "Maximum characters per data line. Default: ${DEFAULT-VALUE}")
    int lineWrap;

    @Option(names = "--chunk-size", defaultValue = "16",
            description = "Maximum byte values per data line. Default: ${DEFAULT-VALUE}")
    int chunkSize;

    @Option(names = "--list-profiles", description = "List the built-in screen profiles and exit.")
    boolean listProfiles;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    private final ScreenProfileLoader profileLoader;

    public DotShop() {
        this(new ScreenProfileLoader());
    }

    DotShop(ScreenProfileLoader profileLoader) {
        this.profileLoader = profileLoader;
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine(new DotShop()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine(DotShop command) {
        CommandLine cmd = new CommandLine(command);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        return cmd;
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (listProfiles) {
            printProfiles(spec.commandLine().getOut());
            return 0;
        }

        if (inputPath == null) {
            throw new ParameterException(spec.commandLine(), "Missing required parameter: INPUT");
        }
        if (profile == null) {
            throw new ParameterException(spec.commandLine(), "Missing required option: --profile");
        }
        if (!inputPath.isFile()) {
            throw new ParameterException(spec.commandLine(),
                    "Input file does not exist: " + inputPath.getAbsolutePath());
        }
        if (!inputPath.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    "Input file is not readable (check permissions): " + inputPath.getAbsolutePath());
        }
        if (outputFile != null && outputFile.isDirectory()) {
            throw new ParameterException(spec.commandLine(),
                    "Output path must be a file, not a directory: " + outputFile.getAbsolutePath());
        }

        Config config = buildConfig();

        CancellationSignal cancellation = new CancellationSignal();
        Thread hook = new Thread(() -> {
            log.info("Interrupt received, cancelling conversion...");
            cancellation.cancel();
        });
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            ScreenProfile screen = profileLoader.resolve(profile);
            SequenceObserver observer = new SequenceObserver() {
                @Override
                public void onComplete(long encoded, long skipped) {
                    log.debug("Sequence complete: {} frame(s) encoded, {} skipped", encoded, skipped);
                }
            };
            ConversionJob job = new ConversionJob(screen, config.quantizer, config.sequencer,
                    transforms, config.emission, observer, cancellation);
            EmissionResult result = job.run(ImageIoFrameSource.factory(inputPath.toPath()));
            writeOutput(result);
        } catch (ModulationException e) {
            log.error("ERROR: {}", e.getMessage());
            log.debug("Failure details", e);
            return 1;
        } catch (IOException e) {
            log.error("ERROR: Cannot convert {}: {}", inputPath.getName(), e.getMessage());
            log.debug("Failure details", e);
            return 1;
        } catch (CancellationException e) {
            log.error("Conversion cancelled");
            return 1;
        } finally {
            removeHook(hook);
        }
        return 0;
    }

    /**
     * Turns option values into validated configuration. Invalid combinations surface as
     * parameter errors (exit code 2), before the input is read.
     */
    private Config buildConfig() {
        try {
            int backgroundRgb = Integer.parseUnsignedInt(background.replaceFirst("^(#|0x)", ""), 16);
            QuantizerOptions quantizer = new QuantizerOptions(dither, threshold, seed, invert, backgroundRgb);
            SequencerOptions sequencer = new SequencerOptions(lookAhead, workers, corruptionTolerance);
            String symbolName = symbol != null ? symbol : IdentifierUtil.sanitize(inputPath.getName());
            EmissionRequest emission = new EmissionRequest(target, symbolName, lineWrap, chunkSize);
            return new Config(quantizer, sequencer, emission);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private void writeOutput(EmissionResult result) throws IOException {
        if (outputFile == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(result.text());
            out.flush();
            return;
        }
        Path destination = outputFile.toPath().toAbsolutePath();
        if (destination.getParent() != null) {
            Files.createDirectories(destination.getParent());
        }
        Files.writeString(destination, result.text(), StandardCharsets.UTF_8);
        log.info("Conversion complete: {} -> {}", inputPath.getName(), destination);
    }

    private void printProfiles(PrintWriter out) {
        for (ScreenProfile builtin : profileLoader.builtins()) {
            out.printf("%-24s %4dx%-4d %-7s %-14s %s%n", builtin.id(), builtin.width(), builtin.height(),
                    builtin.colorMode(), builtin.scanDirection(), builtin.displayName());
        }
        out.flush();
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook has run or is running
            log.debug("Shutdown in progress, hook not removed");
        }
    }

    /**
     * Validated option values handed to the conversion job.
     */
    private record Config(QuantizerOptions quantizer, SequencerOptions sequencer, EmissionRequest emission) {
    }
}
