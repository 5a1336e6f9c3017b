package com.example.d20sim.tools;

import com.example.d20sim.bestiary.Bestiary;
import com.example.d20sim.bestiary.TestCreatureStats;
import com.example.d20sim.data.DataLoadException;
import com.example.d20sim.party.PartyRoster;
import com.example.d20sim.sim.ConfigurationException;
import com.example.d20sim.sim.DebugReport;
import com.example.d20sim.sim.MonteCarloSimulator;
import com.example.d20sim.sim.SimulationConfig;
import com.example.d20sim.sim.SimulationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 *
 * Usage: java -jar d20sim.jar [-a days] [-c Cleric,Fighter,Rogue,Wizard] [-m Kobold,Goblin]
 *        [-n 4,2] [-p level] [-t attack,ac,damage,hp,attacks,proficiency] [-s seed] [-j threads] [-d]
 */
public class SimulatorCli {
    
    private static final Logger logger = LoggerFactory.getLogger(SimulatorCli.class);
    
    static final String USAGE = String.join("\n",
            "Usage: d20sim [options]",
            "  -a, --adventuring-days N   days to simulate (default 1000)",
            "  -c, --classes LIST         comma-separated party classes (default Cleric,Fighter,Rogue,Wizard)",
            "  -m, --monsters LIST        comma-separated monster names (default Kobold)",
            "  -n, --num-monsters LIST    comma-separated monster counts (default 4)",
            "  -p, --party-level N        party level 1-8 (default 1)",
            "  -t, --test-stats LIST      attack,ac,damage,hp,attacks,proficiency for the Test monster",
            "  -s, --seed N               random seed (default: time based)",
            "  -j, --threads N            worker threads (default 1)",
            "  -d, --debug                run one day and print every action",
            "  -h, --help                 show this help");
    
    private static final List<String> DEFAULT_MONSTERS = List.of("Kobold");
    private static final List<Integer> DEFAULT_COUNTS = List.of(4);
    
    /** Parsed command line. */
    static class Options {
        final SimulationConfig config;
        final boolean debug;
        final boolean help;
        
        Options(SimulationConfig config, boolean debug, boolean help) {
            this.config = config;
            this.debug = debug;
            this.help = help;
        }
    }
    
    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }
    
    static int run(String[] args) {
        Options options;
        try {
            options = parse(args);
        } catch (ConfigurationException | DataLoadException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return 2;
        }
        if (options.help) {
            System.out.println(USAGE);
            System.out.println("Classes: " + String.join(", ", PartyRoster.getClassNames()));
            System.out.println("Monsters: " + String.join(", ", Bestiary.getMonsterNames()) + ", "
                    + Bestiary.TEST_CREATURE);
            return 0;
        }
        if (options.debug) {
            DebugReport report = MonteCarloSimulator.debug(options.config);
            System.out.println(report.render());
        } else {
            SimulationResult result = MonteCarloSimulator.simulate(options.config);
            System.out.println(result.summaryLine());
        }
        return 0;
    }
    
    /**
     * Build the configuration from the bundled defaults and the given arguments.
     * @throws ConfigurationException for an unknown option or a malformed or invalid value
     */
    static Options parse(String[] args) {
        SimulationConfig.Builder builder = SimulationConfig.defaults();
        boolean debug = false;
        List<String> monsters = null;
        List<Integer> counts = null;
        boolean testStats = false;
        
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-a":
                case "--adventuring-days":
                    builder.days(parseInt(arg, value(args, ++i, arg)));
                    break;
                case "-c":
                case "--classes":
                    builder.classes(splitList(value(args, ++i, arg)));
                    break;
                case "-m":
                case "--monsters":
                    monsters = splitList(value(args, ++i, arg));
                    break;
                case "-n":
                case "--num-monsters":
                    counts = new ArrayList<>();
                    for (String s : splitList(value(args, ++i, arg))) {
                        counts.add(parseInt(arg, s));
                    }
                    break;
                case "-p":
                case "--party-level":
                    builder.partyLevel(parseInt(arg, value(args, ++i, arg)));
                    break;
                case "-t":
                case "--test-stats":
                    try {
                        builder.testStats(TestCreatureStats.parse(value(args, ++i, arg)));
                        testStats = true;
                    } catch (ConfigurationException e) {
                        throw e;
                    } catch (IllegalArgumentException e) {
                        throw new ConfigurationException(e.getMessage(), e);
                    }
                    break;
                case "-s":
                case "--seed":
                    builder.seed(parseLong(arg, value(args, ++i, arg)));
                    break;
                case "-j":
                case "--threads":
                    builder.threads(parseInt(arg, value(args, ++i, arg)));
                    break;
                case "-d":
                case "--debug":
                    debug = true;
                    break;
                case "-h":
                case "--help":
                    return new Options(null, false, true);
                default:
                    throw new ConfigurationException("Unknown option '" + arg + "'");
            }
        }
        
        if (testStats && monsters == null) {
            monsters = List.of(Bestiary.TEST_CREATURE);
        }
        if (monsters != null || counts != null) {
            builder.monsters(monsters != null ? monsters : DEFAULT_MONSTERS,
                    counts != null ? counts : DEFAULT_COUNTS);
        }
        return new Options(builder.build(), debug, false);
    }
    
    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new ConfigurationException("Option " + option + " needs a value");
        }
        return args[index];
    }
    
    private static List<String> splitList(String text) {
        List<String> items = new ArrayList<>();
        for (String s : text.split(",")) {
            if (!s.trim().isEmpty()) items.add(s.trim());
        }
        return items;
    }
    
    private static int parseInt(String option, String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option " + option + " expects an integer, got '" + text + "'", e);
        }
    }
    
    private static long parseLong(String option, String text) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Option " + option + " expects an integer, got '" + text + "'", e);
        }
    }
}
