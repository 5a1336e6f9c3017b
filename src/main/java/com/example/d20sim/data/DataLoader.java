package com.example.d20sim.data;

import com.example.d20sim.bestiary.LairAction;
import com.example.d20sim.bestiary.MonsterBehavior;
import com.example.d20sim.bestiary.MonsterTemplate;
import com.example.d20sim.combat.Weapon;
import com.example.d20sim.model.*;
import com.example.d20sim.util.Dice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Loads the YAML resources bundled under {@code /data/}.
 */
public class DataLoader {
    
    private static final Logger logger = LoggerFactory.getLogger(DataLoader.class);
    
    /**
     * Read a YAML classpath resource whose top level is a mapping.
     * @throws DataLoadException if the resource is missing, unreadable or not a mapping
     */
    public static Map<String, Object> loadYamlResource(String resource) {
        try (InputStream in = DataLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new DataLoadException("Resource not found: " + resource);
            }
            Object root = new Yaml().load(in);
            if (!(root instanceof Map)) {
                throw new DataLoadException(resource + " does not contain a YAML mapping");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> map = (Map<String, Object>) root;
            return map;
        } catch (IOException | YAMLException e) {
            throw new DataLoadException("Failed to read " + resource + ": " + e.getMessage(), e);
        }
    }
    
    /**
     * Load the monster stat blocks listed under {@code monsters:}.
     * @throws DataLoadException if an entry is malformed
     */
    public static List<MonsterTemplate> loadBestiary(String resource) {
        Map<String, Object> root = loadYamlResource(resource);
        List<MonsterTemplate> templates = new ArrayList<>();
        for (Map<String, Object> data : getMapList(root, "monsters", resource)) {
            String name = getString(data, "name", "");
            try {
                templates.add(parseMonster(data));
            } catch (IllegalArgumentException e) {
                throw new DataLoadException("Bad stat block '" + name + "' in " + resource + ": "
                        + e.getMessage(), e);
            }
        }
        logger.info("Loaded {} monster stat blocks from {}", templates.size(), resource);
        return templates;
    }
    
    static MonsterTemplate parseMonster(Map<String, Object> data) {
        String name = getString(data, "name", "");
        MonsterTemplate.Builder b = MonsterTemplate.builder(name);
        
        Map<String, Object> abilities = getMap(data, "abilities");
        for (Map.Entry<String, Object> e : abilities.entrySet()) {
            b.ability(parse(Ability.fromString(e.getKey()), "ability", e.getKey()), toInt(e.getValue(), e.getKey()));
        }
        b.armorType(parse(ArmorType.fromString(getString(data, "armor_type", "")), "armor type",
                getString(data, "armor_type", "")));
        b.armorClass(getInt(data, "armor_class", 10));
        b.proficiency(getInt(data, "proficiency", 2));
        Dice hitDice = Dice.parse(getString(data, "hit_dice", "1d8"));
        b.hitDice(hitDice.getCount(), hitDice.getSides());
        
        for (String s : getStringList(data, "saves")) b.save(parse(Ability.fromString(s), "ability", s));
        for (String s : getStringList(data, "skills")) b.skill(parse(Skill.fromString(s), "skill", s));
        for (String s : getStringList(data, "expertise")) b.expertise(parse(Skill.fromString(s), "skill", s));
        for (String s : getStringList(data, "immunities")) b.immunity(damageType(s));
        for (String s : getStringList(data, "resistances")) b.resistance(damageType(s));
        for (String s : getStringList(data, "vulnerabilities")) b.vulnerability(damageType(s));
        for (String s : getStringList(data, "traits")) b.trait(parse(Feature.fromString(s), "trait", s));
        for (String s : getStringList(data, "behaviors")) {
            b.behavior(parse(MonsterBehavior.fromString(s), "behavior", s));
        }
        if (data.get("undead") != null) {
            b.undead(getDouble(data, "undead", 0.0));
        }
        b.construct(Boolean.TRUE.equals(data.get("construct")));
        b.attacksPerRound(getInt(data, "attacks_per_round", 1));
        
        for (Map<String, Object> attack : getMapList(data, "attacks", name)) {
            b.attack(parseAttack(attack));
        }
        
        if (data.get("escape_dc") != null) {
            b.escapeDc(getInt(data, "escape_dc", 0));
        }
        Map<String, Object> swallow = getMap(data, "swallow");
        if (!swallow.isEmpty()) {
            if (swallow.get("dice") != null) {
                b.digestion(Dice.parse(getString(swallow, "dice", "")), damageType(getString(swallow, "type", "acid")));
            }
            b.regurgitate(getInt(swallow, "threshold", 0), getInt(swallow, "dc", 0));
        }
        if (data.get("legendary_actions") != null) {
            b.legendaryActions(getInt(data, "legendary_actions", 0), getString(data, "legendary_attack", null));
        }
        if (data.get("lair_actions") != null) {
            for (Map<String, Object> lair : getMapList(data, "lair_actions", name)) {
                b.lairAction(parseLairAction(lair));
            }
        }
        return b.build();
    }
    
    private static LairAction parseLairAction(Map<String, Object> data) {
        String save = getString(data, "save", "dex");
        String dcAbility = getString(data, "dc_ability", "wis");
        Dice dice = data.get("dice") != null ? Dice.parse(getString(data, "dice", "")) : null;
        DamageType type = data.get("type") != null ? damageType(getString(data, "type", "")) : null;
        return new LairAction(getString(data, "name", "Lair action"), dice, type,
                parse(Ability.fromString(save), "ability", save),
                parse(Ability.fromString(dcAbility), "ability", dcAbility),
                !Boolean.FALSE.equals(data.get("half")),
                Boolean.TRUE.equals(data.get("knock_prone")),
                getInt(data, "targets", 1));
    }
    
    private static Weapon parseAttack(Map<String, Object> data) {
        String diceText = getString(data, "dice", "1d4");
        Dice dice = Dice.parse(diceText);
        if (Boolean.TRUE.equals(data.get("great_weapon"))) {
            dice = Dice.greatWeapon(dice.getCount(), dice.getSides());
        }
        String ability = getString(data, "ability", "str");
        Weapon.Builder w = Weapon.builder(getString(data, "name", "Attack"))
                .dice(dice)
                .damageType(damageType(getString(data, "type", "bludgeoning")))
                .ability(parse(Ability.fromString(ability), "ability", ability))
                .proficient(!Boolean.FALSE.equals(data.get("proficient")))
                .attackBonus(getInt(data, "attack_bonus", 0))
                .damageBonus(getInt(data, "damage_bonus", 0));
        if (data.get("secondary_dice") != null) {
            w.secondary(Dice.parse(getString(data, "secondary_dice", "")),
                    damageType(getString(data, "secondary_type", "")));
        }
        return w.build();
    }
    
    private static DamageType damageType(String text) {
        return parse(DamageType.fromString(text), "damage type", text);
    }
    
    private static <T> T parse(T value, String what, String text) {
        if (value == null) {
            throw new IllegalArgumentException("Unknown " + what + " '" + text + "'");
        }
        return value;
    }
    
    // YAML helper methods
    
    public static String getString(Map<String, Object> map, String key, String defaultVal) {
        Object val = map.get(key);
        return val != null ? val.toString() : defaultVal;
    }
    
    public static int getInt(Map<String, Object> map, String key, int defaultVal) {
        Object val = map.get(key);
        return val == null ? defaultVal : toInt(val, key);
    }
    
    public static double getDouble(Map<String, Object> map, String key, double defaultVal) {
        Object val = map.get(key);
        if (val instanceof Number) return ((Number) val).doubleValue();
        if (val instanceof String) {
            try {
                return Double.parseDouble((String) val);
            } catch (NumberFormatException e) {
                throw new DataLoadException("'" + key + "' is not a number: " + val, e);
            }
        }
        return defaultVal;
    }
    
    private static int toInt(Object val, String key) {
        if (val instanceof Number) return ((Number) val).intValue();
        try {
            return Integer.parseInt(val.toString().trim());
        } catch (NumberFormatException e) {
            throw new DataLoadException("'" + key + "' is not an integer: " + val, e);
        }
    }
    
    public static List<String> getStringList(Map<String, Object> map, String key) {
        Object val = map.get(key);
        List<String> result = new ArrayList<>();
        if (val instanceof List) {
            for (Object o : (List<?>) val) {
                result.add(String.valueOf(o));
            }
        } else if (val != null) {
            result.add(val.toString());
        }
        return result;
    }
    
    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (val == null) return Collections.emptyMap();
        if (!(val instanceof Map)) {
            throw new DataLoadException("'" + key + "' is not a mapping");
        }
        return (Map<String, Object>) val;
    }
    
    /** Ordered name to integer mapping, e.g. {@code monsters: {Kobold: 4}}. */
    public static Map<String, Integer> getIntMap(Map<String, Object> map, String key) {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : getMap(map, key).entrySet()) {
            result.put(e.getKey(), toInt(e.getValue(), e.getKey()));
        }
        return result;
    }
    
    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> getMapList(Map<String, Object> map, String key, String owner) {
        Object val = map.get(key);
        if (!(val instanceof List)) {
            throw new DataLoadException(owner + " has no '" + key + "' list");
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object o : (List<?>) val) {
            if (!(o instanceof Map)) {
                throw new DataLoadException(owner + ": entry of '" + key + "' is not a mapping");
            }
            result.add((Map<String, Object>) o);
        }
        return result;
    }
}
