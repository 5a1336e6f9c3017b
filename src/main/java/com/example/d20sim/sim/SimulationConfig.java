package com.example.d20sim.sim;

import com.example.d20sim.bestiary.Bestiary;
import com.example.d20sim.bestiary.TestCreatureStats;
import com.example.d20sim.combat.CombatantFactory;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.data.DataLoader;
import com.example.d20sim.day.DayState;
import com.example.d20sim.day.MonsterGroup;
import com.example.d20sim.party.PartyRoster;
import com.example.d20sim.party.PlayerCharacter;

import java.util.*;

/**
 * Everything one batch of simulated days needs. Immutable and validated on
 * construction; build with {@link #builder()} or start from {@link #defaults()}.
 */
public class SimulationConfig {
    
    public static final String DEFAULTS_RESOURCE = "/data/simulation.yaml";
    public static final int DEFAULT_DAYS = 1000;
    
    private final Map<String, Integer> monsters;
    private final int partyLevel;
    private final List<String> classes;
    private final int days;
    private final long seed;
    private final int threads;
    private final int maxRounds;
    private final int encountersPerDay;
    private final int encountersPerShortRest;
    private final TestCreatureStats testStats;
    
    private SimulationConfig(Builder b, Map<String, Integer> monsters, long seed) {
        this.monsters = Collections.unmodifiableMap(monsters);
        this.partyLevel = b.partyLevel;
        this.classes = Collections.unmodifiableList(new ArrayList<>(b.classes));
        this.days = b.days;
        this.seed = seed;
        this.threads = b.threads;
        this.maxRounds = b.maxRounds;
        this.encountersPerDay = b.encountersPerDay;
        this.encountersPerShortRest = b.encountersPerShortRest;
        this.testStats = b.testStats;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * A builder seeded from the bundled {@code simulation.yaml}.
     * @throws com.example.d20sim.data.DataLoadException if the resource is missing or malformed
     */
    public static Builder defaults() {
        Map<String, Object> root = DataLoader.loadYamlResource(DEFAULTS_RESOURCE);
        Builder b = builder()
                .days(DataLoader.getInt(root, "days", DEFAULT_DAYS))
                .partyLevel(DataLoader.getInt(root, "party_level", 1))
                .maxRounds(DataLoader.getInt(root, "max_rounds", Encounter.DEFAULT_MAX_ROUNDS))
                .threads(DataLoader.getInt(root, "threads", 1))
                .encountersPerDay(DataLoader.getInt(root, "encounters_per_day", DayState.DEFAULT_ENCOUNTERS_PER_DAY))
                .encountersPerShortRest(DataLoader.getInt(root, "encounters_per_short_rest",
                        DayState.DEFAULT_ENCOUNTERS_PER_SHORT_REST));
        List<String> classes = DataLoader.getStringList(root, "classes");
        if (!classes.isEmpty()) b.classes(classes);
        Map<String, Integer> monsters = DataLoader.getIntMap(root, "monsters");
        if (!monsters.isEmpty()) b.monsters(monsters);
        return b;
    }
    
    /** Monster name (as registered) to count, in the order given. */
    public Map<String, Integer> getMonsters() { return monsters; }
    public int getPartyLevel() { return partyLevel; }
    public List<String> getClasses() { return classes; }
    public int getDays() { return days; }
    public long getSeed() { return seed; }
    public int getThreads() { return threads; }
    public int getMaxRounds() { return maxRounds; }
    public int getEncountersPerDay() { return encountersPerDay; }
    public int getEncountersPerShortRest() { return encountersPerShortRest; }
    public TestCreatureStats getTestStats() { return testStats; }
    
    /** Monster groups with their factories resolved. */
    public List<MonsterGroup> monsterGroups() {
        List<MonsterGroup> groups = new ArrayList<>();
        for (Map.Entry<String, Integer> e : monsters.entrySet()) {
            String name = e.getKey();
            CombatantFactory factory = Bestiary.isTestCreature(name)
                    ? Bestiary.testCreature(testStats)
                    : Bestiary.getFactory(name);
            groups.add(new MonsterGroup(name, factory, e.getValue()));
        }
        return groups;
    }
    
    /** E.g. {@code Kobold 4 Goblin 2}, or the test creature's stats followed by its count. */
    public String describeMonsters() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Integer> e : monsters.entrySet()) {
            if (sb.length() > 0) sb.append(' ');
            if (Bestiary.isTestCreature(e.getKey()) && testStats != null) {
                sb.append(String.format("Test %2d %2d %2d %2d %2d %2d", testStats.attack(), testStats.armorClass(),
                        testStats.damage(), testStats.hitPoints(), testStats.attacksPerRound(),
                        testStats.proficiency()));
            } else {
                sb.append(e.getKey());
            }
            sb.append(' ').append(e.getValue());
        }
        return sb.toString();
    }
    
    /** A builder holding this configuration's values. */
    public Builder toBuilder() {
        return builder().monsters(monsters).partyLevel(partyLevel).classes(classes).days(days).seed(seed)
                .threads(threads).maxRounds(maxRounds).encountersPerDay(encountersPerDay)
                .encountersPerShortRest(encountersPerShortRest).testStats(testStats);
    }
    
    @Override
    public String toString() {
        return "SimulationConfig{level " + partyLevel + " " + classes + " vs " + describeMonsters()
                + ", days=" + days + ", seed=" + seed + ", threads=" + threads + "}";
    }
    
    public static class Builder {
        private List<String> monsterNames = new ArrayList<>(List.of("Kobold"));
        private List<Integer> monsterCounts = new ArrayList<>(List.of(4));
        private int partyLevel = 1;
        private List<String> classes = new ArrayList<>(PartyRoster.DEFAULT_PARTY);
        private int days = DEFAULT_DAYS;
        private Long seed;
        private int threads = 1;
        private int maxRounds = Encounter.DEFAULT_MAX_ROUNDS;
        private int encountersPerDay = DayState.DEFAULT_ENCOUNTERS_PER_DAY;
        private int encountersPerShortRest = DayState.DEFAULT_ENCOUNTERS_PER_SHORT_REST;
        private TestCreatureStats testStats;
        
        private Builder() {
        }
        
        public Builder monsters(Map<String, Integer> monsters) {
            this.monsterNames = new ArrayList<>(monsters.keySet());
            this.monsterCounts = new ArrayList<>(monsters.values());
            return this;
        }
        
        /** Parallel lists of names and counts; their lengths must match. */
        public Builder monsters(List<String> names, List<Integer> counts) {
            this.monsterNames = new ArrayList<>(names);
            this.monsterCounts = new ArrayList<>(counts);
            return this;
        }
        
        public Builder partyLevel(int level) { this.partyLevel = level; return this; }
        public Builder classes(List<String> classes) { this.classes = new ArrayList<>(classes); return this; }
        public Builder days(int days) { this.days = days; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder threads(int threads) { this.threads = threads; return this; }
        public Builder maxRounds(int maxRounds) { this.maxRounds = maxRounds; return this; }
        public Builder encountersPerDay(int n) { this.encountersPerDay = n; return this; }
        public Builder encountersPerShortRest(int n) { this.encountersPerShortRest = n; return this; }
        public Builder testStats(TestCreatureStats stats) { this.testStats = stats; return this; }
        
        /**
         * @throws ConfigurationException naming the first invalid input
         */
        public SimulationConfig build() {
            Map<String, Integer> monsters = validate();
            long resolvedSeed = seed != null ? seed : System.nanoTime();
            return new SimulationConfig(this, monsters, resolvedSeed);
        }
        
        private Map<String, Integer> validate() {
            if (monsterNames.size() != monsterCounts.size()) {
                throw new ConfigurationException(monsterNames.size() + " monster names but "
                        + monsterCounts.size() + " counts");
            }
            if (monsterNames.isEmpty()) {
                throw new ConfigurationException("No monsters given");
            }
            Map<String, Integer> monsters = new LinkedHashMap<>();
            for (int i = 0; i < monsterNames.size(); i++) {
                String name = monsterNames.get(i) == null ? "" : monsterNames.get(i).trim();
                Integer count = monsterCounts.get(i);
                String canonical = Bestiary.canonicalName(name);
                if (canonical == null) {
                    throw new ConfigurationException("Unknown monster '" + name + "'");
                }
                if (Bestiary.isTestCreature(canonical) && testStats == null) {
                    throw new ConfigurationException("Monster 'Test' needs test creature stats");
                }
                if (count == null || count < 1) {
                    throw new ConfigurationException("Count for monster '" + name + "' must be positive, got "
                            + count);
                }
                monsters.merge(canonical, count, Integer::sum);
            }
            if (partyLevel < PlayerCharacter.MIN_LEVEL || partyLevel > PlayerCharacter.MAX_LEVEL) {
                throw new ConfigurationException("Party level " + partyLevel + " outside "
                        + PlayerCharacter.MIN_LEVEL + "-" + PlayerCharacter.MAX_LEVEL);
            }
            if (classes.isEmpty()) {
                throw new ConfigurationException("No classes given");
            }
            for (String className : classes) {
                if (!PartyRoster.exists(className == null ? null : className.trim())) {
                    throw new ConfigurationException("Unsupported class '" + className + "'");
                }
            }
            List<String> trimmed = new ArrayList<>();
            for (String className : classes) trimmed.add(className.trim());
            classes = trimmed;
            if (days < 1) {
                throw new ConfigurationException("Number of days must be positive, got " + days);
            }
            if (threads < 1) {
                throw new ConfigurationException("Number of threads must be positive, got " + threads);
            }
            if (maxRounds < 1) {
                throw new ConfigurationException("Round cap must be positive, got " + maxRounds);
            }
            if (encountersPerDay < 1 || encountersPerShortRest < 1) {
                throw new ConfigurationException("Encounters per day and per short rest must be positive, got "
                        + encountersPerDay + " and " + encountersPerShortRest);
            }
            return monsters;
        }
    }
}
