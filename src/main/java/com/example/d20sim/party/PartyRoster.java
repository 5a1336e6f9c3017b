package com.example.d20sim.party;

import com.example.d20sim.combat.CombatContext;
import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.CombatantFactory;

import java.util.*;
import java.util.function.BiFunction;

/**
 * The playable classes, looked up by case-insensitive name.
 */
public class PartyRoster {
    
    private static final Map<String, CombatantFactory> FACTORIES = new LinkedHashMap<>();
    private static final Map<String, String> DISPLAY_NAMES = new LinkedHashMap<>();
    
    /** The party used when no classes are given. */
    public static final List<String> DEFAULT_PARTY = List.of("Cleric", "Fighter", "Rogue", "Wizard");
    
    static {
        registerClass("Cleric", Cleric::new);
        registerClass("Fighter", Fighter::new);
        registerClass("Rogue", Rogue::new);
        registerClass("Wizard", Wizard::new);
    }
    
    private static void registerClass(String className, BiFunction<String, Integer, PlayerCharacter> constructor) {
        register(className, (name, level, context) -> {
            PlayerCharacter pc = constructor.apply(name, level);
            pc.initialize(context);
            return pc;
        });
    }
    
    /**
     * Register a class, replacing any earlier one with the same name. The
     * factory must produce initialized {@link PlayerCharacter}s.
     */
    public static synchronized void register(String className, CombatantFactory factory) {
        if (className == null || factory == null) return;
        String key = className.toLowerCase();
        DISPLAY_NAMES.put(key, className);
        FACTORIES.put(key, factory);
    }
    
    public static synchronized boolean exists(String className) {
        return className != null && FACTORIES.containsKey(className.toLowerCase());
    }
    
    /** @return null for an unknown class */
    public static synchronized CombatantFactory getFactory(String className) {
        if (className == null) return null;
        return FACTORIES.get(className.toLowerCase());
    }
    
    /** @return the canonical spelling of a class name, or null if unknown */
    public static synchronized String canonicalName(String className) {
        if (className == null) return null;
        return DISPLAY_NAMES.get(className.toLowerCase());
    }
    
    public static synchronized List<String> getClassNames() {
        return Collections.unmodifiableList(new ArrayList<>(DISPLAY_NAMES.values()));
    }
    
    /**
     * Build a fresh party at the given level, one member per class name.
     * @throws IllegalArgumentException for an unknown class
     */
    public static List<PlayerCharacter> createParty(List<String> classNames, int level, CombatContext context) {
        List<PlayerCharacter> party = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        for (String className : classNames) {
            CombatantFactory factory = getFactory(className);
            if (factory == null) {
                throw new IllegalArgumentException("Unknown class: " + className);
            }
            String displayName = canonicalName(className);
            int copies = Collections.frequency(lowercase(classNames), className.toLowerCase());
            int index = seen.merge(displayName, 1, Integer::sum);
            Combatant pc = factory.create(copies > 1 ? displayName + " " + index : displayName, level, context);
            if (!(pc instanceof PlayerCharacter)) {
                throw new IllegalArgumentException("Class " + className + " did not produce a player character");
            }
            party.add((PlayerCharacter) pc);
        }
        return party;
    }
    
    private static List<String> lowercase(List<String> names) {
        List<String> result = new ArrayList<>();
        for (String n : names) result.add(n.toLowerCase());
        return result;
    }
}
