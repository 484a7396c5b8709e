package io.feydor.midiconvert;

import com.google.gson.JsonParseException;
import io.feydor.midiconvert.json.MidiJson;
import io.feydor.midiconvert.midi.Midi;
import io.feydor.midiconvert.smf.exceptions.MidiParseException;
import io.feydor.midiconvert.transport.MidiLoader;
import io.feydor.midiconvert.util.TextFns;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts between MIDI files and their JSON form.
 * <p>
 * A .json input is encoded to a MIDI file, anything else, a path or an http(s) URL, is decoded to JSON.
 *
 * <p>Usage: java MidiConvertCli [options] song.mid</p>
 */
public final class MidiConvertCli {
    private static final Logger LOGGER = Logger.getLogger(MidiConvertCli.class.getName());
    static final String VERSION = "0.1.0";

    private final MidiLoader loader;
    private final PrintStream out;
    private final PrintStream err;

    public static void main(String[] args) {
        System.exit(new MidiConvertCli(new MidiLoader(), System.out, System.err).run(args));
    }

    public MidiConvertCli(MidiLoader loader, PrintStream out, PrintStream err) {
        this.loader = loader;
        this.out = out;
        this.err = err;
    }

    /**
     * @return the exit status: 0 on success, 1 for bad usage, 2 when the conversion failed
     */
    public int run(String[] args) {
        if (args.length < 1 || TextFns.isBlank(args[0])) {
            printOptions();
            return 1;
        }

        String input = null, output = null;
        Double bpm = null;
        double[] slice = null;
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            try {
                switch (arg) {
                    case "-V", "--version" -> {
                        printVersion();
                        return 0;
                    }
                    case "-h", "-H", "--help" -> {
                        printOptions();
                        return 0;
                    }
                    case "-v", "--verbose" -> setVerbose();
                    case "-o", "--output" -> output = valueOf(args, ++i, arg);
                    case "-b", "--bpm" -> bpm = Double.parseDouble(valueOf(args, ++i, arg));
                    case "-s", "--slice" -> slice = parseSlice(valueOf(args, ++i, arg));
                    default -> {
                        if (arg.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        input = arg;
                    }
                }
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                printOptions();
                return 1;
            }
        }

        if (input == null) {
            err.println("No input file was given");
            printOptions();
            return 1;
        }

        try {
            convert(input, output, bpm, slice);
            return 0;
        } catch (IOException e) {
            err.printf("The file failed to load: %s\n%s\n", input, e.getMessage());
        } catch (MidiParseException e) {
            err.printf("The MIDI file failed to parse: %s\n%s\n", input, e.getMessage());
        } catch (JsonParseException e) {
            err.printf("The JSON file failed to parse: %s\n%s\n", input, e.getMessage());
        } catch (IllegalArgumentException e) {
            err.printf("The file could not be converted: %s\n%s\n", input, e.getMessage());
        }
        LOGGER.log(Level.FINE, "Conversion of {0} failed", input);
        return 2;
    }

    private void convert(String input, String output, Double bpm, double[] slice) throws IOException {
        boolean toMidi = input.toLowerCase(Locale.ROOT).endsWith(".json");
        Midi midi = toMidi
                ? MidiJson.fromJson(new String(loader.fetch(input), StandardCharsets.UTF_8))
                : loader.load(input);
        LOGGER.log(Level.FINE, "Loaded {0}: {1}", new Object[]{input, midi});

        if (slice != null) {
            midi = midi.slice(slice[0], slice[1]);
        }
        if (bpm != null) {
            midi.setBpm(bpm);
        }

        if (toMidi) {
            var path = Path.of(output != null ? output : input.substring(0, input.length() - ".json".length()) + ".mid");
            Files.write(path, midi.encode());
            out.printf("Wrote %s\n", path);
        } else if (output != null) {
            Files.writeString(Path.of(output), MidiJson.toJson(midi), StandardCharsets.UTF_8);
            out.printf("Wrote %s\n", output);
        } else {
            out.println(MidiJson.toJson(midi));
        }
    }

    private static String valueOf(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing the value of " + option);
        }
        return args[i];
    }

    /** "start:end" in seconds */
    static double[] parseSlice(String value) {
        var parts = value.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("A slice is start:end in seconds, given: " + value);
        }
        return new double[]{Double.parseDouble(parts[0]), Double.parseDouble(parts[1])};
    }

    private static void setVerbose() {
        var root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (var handler : root.getHandlers()) {
            handler.setLevel(Level.FINE);
        }
    }

    private void printOptions() {
        String msg = "\nmidiconvert\n\nUsage: midiconvert [options] <MIDI file, URL or JSON file>\n\n";
        msg += "Options:\n";
        msg += "\n  -o,--output <file>    Write to this file instead of the default";
        msg += "\n  -b,--bpm <bpm>        Change the tempo before writing";
        msg += "\n  -s,--slice <s:e>      Keep only what happens from s to e seconds";
        msg += "\n  -V,--version          Print version information";
        msg += "\n  -h,--help             Print this message";
        msg += "\n  -v,--verbose          Print extra logs";
        out.println(msg);
    }

    private void printVersion() {
        out.println("midiconvert " + VERSION + "\nCopyright (C) 2023 feydor\n");
    }
}
