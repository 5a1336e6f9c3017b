package com.example.d20sim.spell;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Registry of spells and their handlers, keyed by lowercase name.
 */
public class SpellRegistry {
    
    private static final Map<String, SpellHandler> HANDLERS = new HashMap<>();
    private static final Map<String, Spell> SPELLS = new HashMap<>();
    
    static {
        DivineSpellHandler.registerAll();
        ArcaneSpellHandler.registerAll();
    }
    
    public static void register(Spell spell, SpellHandler handler) {
        if (spell == null || handler == null) return;
        String key = spell.getName().toLowerCase();
        SPELLS.put(key, spell);
        HANDLERS.put(key, handler);
    }
    
    public static SpellHandler getHandler(String name) {
        if (name == null) return null;
        return HANDLERS.get(name.toLowerCase());
    }
    
    public static Spell getSpell(String name) {
        if (name == null) return null;
        return SPELLS.get(name.toLowerCase());
    }
    
    public static Map<String, Spell> getAll() { return Collections.unmodifiableMap(SPELLS); }
    
    public static boolean exists(String name) { return name != null && SPELLS.containsKey(name.toLowerCase()); }
}
