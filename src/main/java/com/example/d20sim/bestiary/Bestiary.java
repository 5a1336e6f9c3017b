package com.example.d20sim.bestiary;

import com.example.d20sim.combat.CombatantFactory;
import com.example.d20sim.data.DataLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Registry of monster factories keyed by lowercase name. The bundled stat
 * blocks are loaded from {@code /data/bestiary.yaml} on first use; more can be
 * registered at runtime.
 */
public class Bestiary {
    
    private static final Logger logger = LoggerFactory.getLogger(Bestiary.class);
    
    public static final String RESOURCE = "/data/bestiary.yaml";
    
    /** Name of the parametric monster built from {@link TestCreatureStats}. */
    public static final String TEST_CREATURE = "Test";
    
    private static final Map<String, CombatantFactory> FACTORIES = new LinkedHashMap<>();
    private static final Map<String, String> DISPLAY_NAMES = new LinkedHashMap<>();
    private static final Map<String, MonsterTemplate> TEMPLATES = new HashMap<>();
    private static boolean loaded = false;
    
    private static synchronized void ensureLoaded() {
        if (loaded) return;
        loaded = true;
        List<MonsterTemplate> templates = DataLoader.loadBestiary(RESOURCE);
        for (MonsterTemplate template : templates) {
            registerTemplate(template);
        }
        logger.debug("Loaded {} monsters from {}", templates.size(), RESOURCE);
    }
    
    /** Register a stat block under its own name, replacing any earlier entry. */
    public static synchronized void registerTemplate(MonsterTemplate template) {
        ensureLoaded();
        String key = template.getName().toLowerCase();
        TEMPLATES.put(key, template);
        register(template.getName(), (name, level, context) -> template.spawn(name, context));
    }
    
    /** Register a custom factory, replacing any earlier entry with the same name. */
    public static synchronized void register(String monsterName, CombatantFactory factory) {
        if (monsterName == null || factory == null) return;
        ensureLoaded();
        String key = monsterName.toLowerCase();
        FACTORIES.put(key, factory);
        DISPLAY_NAMES.put(key, monsterName);
    }
    
    /** @return null for an unknown monster; the Test creature needs {@link #testCreature} */
    public static synchronized CombatantFactory getFactory(String monsterName) {
        if (monsterName == null) return null;
        ensureLoaded();
        return FACTORIES.get(monsterName.toLowerCase());
    }
    
    public static synchronized MonsterTemplate getTemplate(String monsterName) {
        if (monsterName == null) return null;
        ensureLoaded();
        return TEMPLATES.get(monsterName.toLowerCase());
    }
    
    public static synchronized boolean exists(String monsterName) {
        return getFactory(monsterName) != null;
    }
    
    public static boolean isTestCreature(String monsterName) {
        return TEST_CREATURE.equalsIgnoreCase(monsterName);
    }
    
    /** @return the registered spelling of a monster name, or null if unknown */
    public static synchronized String canonicalName(String monsterName) {
        if (monsterName == null) return null;
        if (isTestCreature(monsterName)) return TEST_CREATURE;
        ensureLoaded();
        return DISPLAY_NAMES.get(monsterName.toLowerCase());
    }
    
    public static synchronized List<String> getMonsterNames() {
        ensureLoaded();
        return Collections.unmodifiableList(new ArrayList<>(DISPLAY_NAMES.values()));
    }
    
    public static CombatantFactory testCreature(TestCreatureStats stats) {
        MonsterTemplate template = stats.toTemplate();
        return (name, level, context) -> template.spawn(name, context);
    }
}
