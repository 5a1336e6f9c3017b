package com.example.d20sim.bestiary;

import com.example.d20sim.combat.CombatContext;
import com.example.d20sim.combat.Weapon;
import com.example.d20sim.model.*;
import com.example.d20sim.util.Dice;

import java.util.*;

/**
 * Stat block for a kind of monster. Instances are spawned from it fresh for
 * every encounter. Immutable; build with {@link #builder(String)}.
 */
public class MonsterTemplate {
    
    private final String name;
    private final EnumMap<Ability, Integer> abilities;
    private final ArmorType armorType;
    private final int armorClass;
    private final int proficiency;
    
    // Hit points: roll hitPointDice, add hitPointBonus and CON per hit die
    private final int hitDieSides;
    private final int hitDice;
    private final Dice hitPointDice;
    private final int hitPointBonus;
    
    private final Set<Ability> saveProficiencies;
    private final Set<Skill> skillProficiencies;
    private final Set<Skill> skillExpertise;
    private final Set<DamageType> immunities;
    private final Set<DamageType> resistances;
    private final Set<DamageType> vulnerabilities;
    private final Set<Feature> traits;
    private final Double undeadRating;
    private final boolean construct;
    
    private final List<Weapon> attacks;
    private final int attacksPerRound;
    private final Set<MonsterBehavior> behaviors;
    
    // Grapple and swallow; escape DC null means 8 + proficiency + Strength
    private final Integer escapeDc;
    private final Dice digestionDice;
    private final DamageType digestionType;
    private final int regurgitateThreshold;
    private final int regurgitateDc;
    
    private final int legendaryActions;
    private final String legendaryAttack;
    private final List<LairAction> lairActions;
    
    private MonsterTemplate(Builder b) {
        this.name = b.name;
        this.abilities = new EnumMap<>(b.abilities);
        this.armorType = b.armorType;
        this.armorClass = b.armorClass;
        this.proficiency = b.proficiency;
        this.hitDieSides = b.hitDieSides;
        this.hitDice = b.hitDice;
        this.hitPointDice = b.hitPointDice != null ? b.hitPointDice : Dice.of(b.hitDice, b.hitDieSides);
        this.hitPointBonus = b.hitPointBonus;
        this.saveProficiencies = Collections.unmodifiableSet(b.saveProficiencies);
        this.skillProficiencies = Collections.unmodifiableSet(b.skillProficiencies);
        this.skillExpertise = Collections.unmodifiableSet(b.skillExpertise);
        this.immunities = Collections.unmodifiableSet(b.immunities);
        this.resistances = Collections.unmodifiableSet(b.resistances);
        this.vulnerabilities = Collections.unmodifiableSet(b.vulnerabilities);
        this.traits = Collections.unmodifiableSet(b.traits);
        this.undeadRating = b.undeadRating;
        this.construct = b.construct;
        this.attacks = Collections.unmodifiableList(new ArrayList<>(b.attacks));
        this.attacksPerRound = b.attacksPerRound;
        this.behaviors = Collections.unmodifiableSet(b.behaviors);
        this.escapeDc = b.escapeDc;
        this.digestionDice = b.digestionDice;
        this.digestionType = b.digestionType;
        this.regurgitateThreshold = b.regurgitateThreshold;
        this.regurgitateDc = b.regurgitateDc;
        this.legendaryActions = b.legendaryActions;
        this.legendaryAttack = b.legendaryAttack;
        this.lairActions = Collections.unmodifiableList(new ArrayList<>(b.lairActions));
    }
    
    public static Builder builder(String name) {
        return new Builder(name);
    }
    
    public String getName() { return name; }
    public int getAbility(Ability ability) { return abilities.getOrDefault(ability, 0); }
    public ArmorType getArmorType() { return armorType; }
    public int getArmorClass() { return armorClass; }
    public int getProficiency() { return proficiency; }
    public int getHitDieSides() { return hitDieSides; }
    public int getHitDice() { return hitDice; }
    public Dice getHitPointDice() { return hitPointDice; }
    public int getHitPointBonus() { return hitPointBonus; }
    public Set<Ability> getSaveProficiencies() { return saveProficiencies; }
    public Set<Skill> getSkillProficiencies() { return skillProficiencies; }
    public Set<Skill> getSkillExpertise() { return skillExpertise; }
    public Set<DamageType> getImmunities() { return immunities; }
    public Set<DamageType> getResistances() { return resistances; }
    public Set<DamageType> getVulnerabilities() { return vulnerabilities; }
    public Set<Feature> getTraits() { return traits; }
    public Double getUndeadRating() { return undeadRating; }
    public boolean isConstruct() { return construct; }
    public List<Weapon> getAttacks() { return attacks; }
    public int getAttacksPerRound() { return attacksPerRound; }
    public Set<MonsterBehavior> getBehaviors() { return behaviors; }
    
    public boolean hasBehavior(MonsterBehavior behavior) {
        return behaviors.contains(behavior);
    }
    
    public Integer getEscapeDc() { return escapeDc; }
    public Dice getDigestionDice() { return digestionDice; }
    public DamageType getDigestionType() { return digestionType; }
    public int getRegurgitateThreshold() { return regurgitateThreshold; }
    public int getRegurgitateDc() { return regurgitateDc; }
    public int getLegendaryActions() { return legendaryActions; }
    public List<LairAction> getLairActions() { return lairActions; }
    
    /** @return the attack made with each legendary action, or null without legendary actions */
    public Weapon getLegendaryAttack() {
        if (legendaryActions == 0) return null;
        for (Weapon w : attacks) {
            if (w.getName().equalsIgnoreCase(legendaryAttack)) return w;
        }
        return attacks.get(attacks.size() - 1);
    }
    
    /** Fresh, initialized monster with the given instance name. */
    public Monster spawn(String instanceName, CombatContext context) {
        Monster monster = new Monster(instanceName, this);
        monster.initialize(context);
        return monster;
    }
    
    @Override
    public String toString() {
        return name + " (AC " + armorClass + ", " + hitPointDice + ", " + attacks.size() + " attacks)";
    }
    
    public static class Builder {
        private final String name;
        private final EnumMap<Ability, Integer> abilities = new EnumMap<>(Ability.class);
        private ArmorType armorType = ArmorType.NONE;
        private int armorClass = 10;
        private int proficiency = 2;
        private int hitDieSides = 8;
        private int hitDice = 1;
        private Dice hitPointDice;
        private int hitPointBonus;
        private final EnumSet<Ability> saveProficiencies = EnumSet.noneOf(Ability.class);
        private final EnumSet<Skill> skillProficiencies = EnumSet.noneOf(Skill.class);
        private final EnumSet<Skill> skillExpertise = EnumSet.noneOf(Skill.class);
        private final EnumSet<DamageType> immunities = EnumSet.noneOf(DamageType.class);
        private final EnumSet<DamageType> resistances = EnumSet.noneOf(DamageType.class);
        private final EnumSet<DamageType> vulnerabilities = EnumSet.noneOf(DamageType.class);
        private final EnumSet<Feature> traits = EnumSet.noneOf(Feature.class);
        private Double undeadRating;
        private boolean construct;
        private final List<Weapon> attacks = new ArrayList<>();
        private int attacksPerRound = 1;
        private final EnumSet<MonsterBehavior> behaviors = EnumSet.noneOf(MonsterBehavior.class);
        private Integer escapeDc;
        private Dice digestionDice;
        private DamageType digestionType = DamageType.ACID;
        private int regurgitateThreshold;
        private int regurgitateDc;
        private int legendaryActions;
        private String legendaryAttack;
        private final List<LairAction> lairActions = new ArrayList<>();
        
        private Builder(String name) {
            this.name = name;
        }
        
        /** Modifiers in the order STR, DEX, CON, INT, WIS, CHA. */
        public Builder abilities(int str, int dex, int con, int intel, int wis, int cha) {
            abilities.put(Ability.STRENGTH, str);
            abilities.put(Ability.DEXTERITY, dex);
            abilities.put(Ability.CONSTITUTION, con);
            abilities.put(Ability.INTELLIGENCE, intel);
            abilities.put(Ability.WISDOM, wis);
            abilities.put(Ability.CHARISMA, cha);
            return this;
        }
        
        public Builder ability(Ability ability, int modifier) { abilities.put(ability, modifier); return this; }
        public Builder armorType(ArmorType type) { this.armorType = type; return this; }
        public Builder armorClass(int ac) { this.armorClass = ac; return this; }
        public Builder proficiency(int proficiency) { this.proficiency = proficiency; return this; }
        
        public Builder hitDice(int count, int sides) {
            this.hitDice = count;
            this.hitDieSides = sides;
            return this;
        }
        
        /** Hit points rolled as these dice plus a constant, replacing the hit dice roll. */
        public Builder hitPoints(Dice dice, int bonus) {
            this.hitPointDice = dice;
            this.hitPointBonus = bonus;
            return this;
        }
        
        public Builder save(Ability ability) { saveProficiencies.add(ability); return this; }
        public Builder skill(Skill skill) { skillProficiencies.add(skill); return this; }
        
        public Builder expertise(Skill skill) {
            skillProficiencies.add(skill);
            skillExpertise.add(skill);
            return this;
        }
        
        public Builder immunity(DamageType type) { immunities.add(type); return this; }
        public Builder resistance(DamageType type) { resistances.add(type); return this; }
        public Builder vulnerability(DamageType type) { vulnerabilities.add(type); return this; }
        public Builder trait(Feature feature) { traits.add(feature); return this; }
        public Builder undead(double rating) { this.undeadRating = rating; return this; }
        public Builder construct(boolean construct) { this.construct = construct; return this; }
        public Builder attack(Weapon weapon) { attacks.add(weapon); return this; }
        public Builder attacksPerRound(int n) { this.attacksPerRound = n; return this; }
        public Builder behavior(MonsterBehavior behavior) { behaviors.add(behavior); return this; }
        public Builder escapeDc(int dc) { this.escapeDc = dc; return this; }
        
        /** Damage dealt to each swallowed creature at the start of the swallower's turns. */
        public Builder digestion(Dice dice, DamageType type) {
            this.digestionDice = dice;
            this.digestionType = type;
            return this;
        }
        
        /** Damage in one turn from inside that forces a Constitution save against regurgitating. */
        public Builder regurgitate(int threshold, int dc) {
            this.regurgitateThreshold = threshold;
            this.regurgitateDc = dc;
            return this;
        }
        
        /** Legendary actions per round, each an attack with the named weapon (the last one if null). */
        public Builder legendaryActions(int n, String attackName) {
            this.legendaryActions = n;
            this.legendaryAttack = attackName;
            return this;
        }
        
        /** Lair actions are used in turn, one per round. */
        public Builder lairAction(LairAction action) { lairActions.add(action); return this; }
        
        /**
         * @throws IllegalArgumentException if the stat block has no attack or a
         *         behavior lacks the attacks it needs
         */
        public MonsterTemplate build() {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Monster needs a name");
            }
            if (attacks.isEmpty()) {
                throw new IllegalArgumentException(name + " has no attacks");
            }
            if ((behaviors.contains(MonsterBehavior.RAMPAGE) || behaviors.contains(MonsterBehavior.PARALYZING_CLAWS))
                    && attacks.size() < 2) {
                throw new IllegalArgumentException(name + " needs a second attack for its behaviors");
            }
            if (behaviors.contains(MonsterBehavior.SWALLOW) && !behaviors.contains(MonsterBehavior.GRAPPLE)) {
                throw new IllegalArgumentException(name + " can only swallow what it grapples");
            }
            if (legendaryActions < 0) {
                throw new IllegalArgumentException(name + " has a negative number of legendary actions");
            }
            if (legendaryAttack != null
                    && attacks.stream().noneMatch(w -> w.getName().equalsIgnoreCase(legendaryAttack))) {
                throw new IllegalArgumentException(name + " has no attack named " + legendaryAttack);
            }
            if (attacksPerRound < 1) {
                throw new IllegalArgumentException(name + " must make at least one attack per round");
            }
            if (behaviors.isEmpty()) {
                behaviors.add(MonsterBehavior.PLAIN_ATTACK);
            }
            return new MonsterTemplate(this);
        }
    }
}
