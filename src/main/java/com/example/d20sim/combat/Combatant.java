package com.example.d20sim.combat;

import com.example.d20sim.effect.ConcentrationEffect;
import com.example.d20sim.effect.Duration;
import com.example.d20sim.model.*;
import com.example.d20sim.resource.LimitedResource;
import com.example.d20sim.util.DiceRoller;

import java.util.*;

/**
 * A participant in an encounter: a player character or a monster.
 *
 * <p>Subclasses fill in their statistics in {@link #initializeFeatures()},
 * decide how hit points are determined in {@link #computeMaxHitPoints()} and
 * describe their behavior as a {@link TurnPlan}. Everything else here is the
 * shared rules engine: saving throws, damage, healing, conditions, durations,
 * concentration and the action economy of a turn.
 *
 * <p>Hit points stay within [0, max] after every call that changes them;
 * a combatant at 0 is unconscious but stays in the encounter.
 */
public abstract class Combatant {

    /** Concentration spells and most timed effects last this many rounds */
    public static final int STANDARD_DURATION_ROUNDS = 10;

    protected final String name;
    protected final Team team;

    // Statistics, set by initializeFeatures()

    protected final EnumMap<Ability, Integer> abilities = new EnumMap<>(Ability.class);
    protected final EnumSet<Ability> saveProficiencies = EnumSet.noneOf(Ability.class);
    protected final EnumSet<Skill> skillProficiencies = EnumSet.noneOf(Skill.class);
    protected final EnumSet<Skill> skillExpertise = EnumSet.noneOf(Skill.class);
    protected final EnumSet<Skill> skillDisadvantage = EnumSet.noneOf(Skill.class);
    protected final EnumSet<Feature> features = EnumSet.noneOf(Feature.class);
    protected final EnumSet<DamageType> immunities = EnumSet.noneOf(DamageType.class);
    protected final EnumSet<DamageType> resistances = EnumSet.noneOf(DamageType.class);
    protected final EnumSet<DamageType> vulnerabilities = EnumSet.noneOf(DamageType.class);
    protected ArmorType armorType = ArmorType.NONE;
    protected int baseArmorClass = 10;
    protected int proficiency = 2;
    protected int hitDieSides = 8;
    protected int totalHitDice = 1;
    protected int critThreshold = 20;
    protected int critMultiplier = 2;
    protected int attackModifier = 0;
    protected int damageModifier = 0;
    protected int initiativeModifier = 0;
    /** Challenge rating if undead, null otherwise */
    protected Double undeadRating = null;
    protected boolean construct = false;
    /** Legendary actions regained at the start of each of its turns */
    protected int legendaryActions = 0;

    // Hit points

    private int maxHitPoints;
    private int hitPoints;
    private int hitDiceRemaining;

    // Turn state

    private boolean action;
    private boolean bonusAction;
    private boolean reaction;
    private boolean surprised = true;
    private boolean prone;
    private boolean deathWard;
    private int aidBonus;
    private int stealth;
    private int legendaryActionsLeft;

    /** Durations this combatant bears */
    private final List<Duration> durations = new ArrayList<>();

    /** Durations on anyone whose clock runs on this combatant's turns */
    private final List<Duration> keptDurations = new ArrayList<>();

    private ConcentrationEffect concentration;

    private final Map<String, LimitedResource> resources = new LinkedHashMap<>();

    private TurnPlan turnPlan;

    protected CombatContext context;

    protected Combatant(String name, Team team) {
        this.name = name;
        this.team = team;
        for (Ability a : Ability.values()) {
            abilities.put(a, 0);
        }
    }

    // Lifecycle

    /**
     * Set up statistics, resources, hit points and behavior before the
     * combatant's first encounter.
     */
    public final void initialize(CombatContext context) {
        this.context = context;
        initializeFeatures();
        resetHitPoints();
        hitDiceRemaining = totalHitDice;
        resetConditions();
        turnPlan = buildTurnPlan();
    }

    protected abstract void initializeFeatures();

    protected abstract int computeMaxHitPoints();

    protected abstract TurnPlan buildTurnPlan();

    public void resetHitPoints() {
        maxHitPoints = computeMaxHitPoints();
        hitPoints = maxHitPoints;
    }

    /** Called once at the start of each encounter this combatant takes part in. */
    public void startEncounter(Encounter encounter) {
        surprised = true;
    }

    /** Called after an encounter the combatant survived. */
    public void endEncounter(Encounter encounter) {
    }

    /**
     * Clear everything that only lasts for an encounter: actions, surprise,
     * stealth and every duration this combatant bears or keeps.
     */
    public void resetConditions() {
        action = false;
        bonusAction = false;
        reaction = false;
        surprised = true;
        stealth = 0;
        legendaryActionsLeft = legendaryActions;
        for (Duration d : new ArrayList<>(durations)) {
            d.end();
        }
        for (Duration d : new ArrayList<>(keptDurations)) {
            d.end();
        }
        if (hitPoints > 0) {
            prone = false;
        }
        concentration = null;
    }

    // Turn

    /**
     * Play this combatant's whole turn: refresh the action economy, run
     * start-of-turn durations, act, then run end-of-turn durations.
     */
    public final void resolveTurn(Encounter encounter) {
        surprised = false;
        bonusAction = true;
        legendaryActionsLeft = legendaryActions;
        if (!hasCondition(Condition.TURNED)) {
            action = true;
            reaction = !hasCondition(Condition.SLOWED);
        }

        for (Duration d : new ArrayList<>(keptDurations)) {
            if (d.getClock() == Duration.Clock.KEEPER_TURN_START) d.tick();
        }
        for (Duration d : new ArrayList<>(durations)) {
            if (d.getClock() == Duration.Clock.BEARER_TURN_START) d.tick();
        }
        for (Duration d : new ArrayList<>(keptDurations)) {
            if (!d.isEnded()) d.onKeeperTurnStart(encounter);
        }
        for (Duration d : new ArrayList<>(durations)) {
            if (!d.isEnded()) d.onBearerTurnStart(encounter);
        }

        if (hitPoints > 0 && !isIncapacitated()) {
            prone = false;
            if (concentration != null) {
                concentration.tick();
            }
            onTurnStart(encounter);
            context.getTrace().note(TraceEvent.Type.TURN, this, null, null, hitPoints + "/" + maxHitPoints + " hp");
            takeTurn(encounter);
        }

        for (Duration d : new ArrayList<>(durations)) {
            if (!d.isEnded()) d.onBearerTurnEnd(encounter);
        }
        for (Duration d : new ArrayList<>(keptDurations)) {
            if (d.getClock() == Duration.Clock.KEEPER_TURN_END) d.tick();
        }
        for (Duration d : new ArrayList<>(durations)) {
            if (d.getClock() == Duration.Clock.BEARER_TURN_END) d.tick();
        }
    }

    /**
     * Act according to this combatant's turn plan. Does nothing if the
     * combatant is unconscious or incapacitated.
     */
    public final void takeTurn(Encounter encounter) {
        if (hitPoints <= 0 || isIncapacitated()) {
            return;
        }
        turnPlan.execute(this, encounter);
    }

    /** Per-turn bookkeeping before acting, e.g. refreshing a once-per-turn feature. */
    protected void onTurnStart(Encounter encounter) {
    }

    public TurnPlan getTurnPlan() { return turnPlan; }

    // Lair and legendary actions

    /** Whether this combatant acts on initiative count 20 through {@link #lairAction}. */
    public boolean hasLairAction() {
        return false;
    }

    /** Act in the lair on initiative count 20. */
    protected void lairAction(Encounter encounter) {
    }

    /** Spend one legendary action at the end of another combatant's turn. */
    protected void legendaryAction(Encounter encounter) {
    }

    /** Take the lair action unless unconscious or incapacitated. */
    public final void takeLairAction(Encounter encounter) {
        if (hitPoints <= 0 || isIncapacitated()) {
            return;
        }
        context.getTrace().note(TraceEvent.Type.ABILITY, this, "Lair action", null, null);
        lairAction(encounter);
    }

    /**
     * Take a legendary action if one is left this round and the combatant can act.
     * @return true if one was spent
     */
    public final boolean takeLegendaryAction(Encounter encounter) {
        if (legendaryActionsLeft <= 0 || hitPoints <= 0 || isIncapacitated()) {
            return false;
        }
        legendaryActionsLeft--;
        context.getTrace().note(TraceEvent.Type.ABILITY, this, "Legendary action", null,
                legendaryActionsLeft + " left");
        legendaryAction(encounter);
        return true;
    }

    public int getLegendaryActions() { return legendaryActions; }

    public int getLegendaryActionsLeft() { return legendaryActionsLeft; }

    // Action economy

    public boolean hasSlot(ActionSlot slot) {
        switch (slot) {
            case ACTION: return action;
            case BONUS_ACTION: return bonusAction;
            case REACTION: return reaction;
            default: return true;
        }
    }

    /**
     * Use up part of the turn. A slowed combatant gives up its bonus action when
     * using its action and vice versa.
     */
    public void spendSlot(ActionSlot slot) {
        boolean slowed = hasCondition(Condition.SLOWED);
        switch (slot) {
            case ACTION:
                action = false;
                if (slowed) bonusAction = false;
                break;
            case BONUS_ACTION:
                bonusAction = false;
                if (slowed) action = false;
                break;
            case REACTION:
                reaction = false;
                break;
            default:
                break;
        }
    }

    public boolean isSurprised() { return surprised; }

    // Abilities, skills and proficiency

    public String getName() { return name; }

    public Team getTeam() { return team; }

    public int getAbility(Ability ability) {
        return abilities.get(ability);
    }

    public int getProficiency() { return proficiency; }

    public boolean hasFeature(Feature feature) {
        return features.contains(feature);
    }

    public boolean isSaveProficient(Ability ability) {
        return saveProficiencies.contains(ability);
    }

    public int skillModifier(Skill skill) {
        int mod = getAbility(skill.getAbility());
        if (skillProficiencies.contains(skill)) mod += proficiency;
        if (skillExpertise.contains(skill)) mod += proficiency;
        return mod;
    }

    public int passivePerception() {
        int passive = 10 + skillModifier(Skill.PERCEPTION);
        if (hasSkillAdvantage(Skill.PERCEPTION)) passive += 5;
        return passive;
    }

    private boolean hasSkillAdvantage(Skill skill) {
        return skill == Skill.PERCEPTION && hasFeature(Feature.KEEN_SENSES);
    }

    public int rollSkill(Skill skill) {
        boolean disadvantage = skillDisadvantage.contains(skill)
                || hasCondition(Condition.FRIGHTENED) || hasCondition(Condition.POISONED);
        return dice().d20(hasSkillAdvantage(skill), disadvantage) + skillModifier(skill);
    }

    /** Take the Hide action: the stealth roll stands until this combatant attacks. */
    public int hide() {
        stealth = rollSkill(Skill.STEALTH);
        context.getTrace().record(TraceEvent.Type.ABILITY, this, "Hide", null, stealth, 0, null);
        return stealth;
    }

    public int getStealth() { return stealth; }

    /** Attacking gives away position. */
    public void reveal() {
        stealth = 0;
    }

    /**
     * Whether this combatant is hidden from an observer: invisible or beating
     * the observer's passive Perception, unless the observer has blindsight.
     */
    public boolean isHiddenFrom(Combatant observer) {
        if (observer.hasFeature(Feature.BLINDSIGHT)) return false;
        return hasCondition(Condition.INVISIBLE) || stealth > observer.passivePerception();
    }

    public int rollInitiative() {
        return dice().d20() + getAbility(Ability.DEXTERITY) + initiativeModifier;
    }

    // Armor and attacks

    public int getArmorClass() {
        return armorType.armorClass(baseArmorClass, getAbility(Ability.DEXTERITY));
    }

    public int getCritThreshold() { return critThreshold; }

    public int getCritMultiplier() { return critMultiplier; }

    public int getAttackModifier() { return attackModifier; }

    public int getDamageModifier() { return damageModifier; }

    public boolean hasAttackAdvantage(Combatant target) {
        if (target.hasCondition(Condition.MARKED) || target.isIncapacitated()) {
            return true;
        }
        return target.hasCondition(Condition.PRONE)
                || target.hasCondition(Condition.BLINDED)
                || target.hasCondition(Condition.RESTRAINED)
                || (isHiddenFrom(target) && !target.hasFeature(Feature.ALERT));
    }

    public boolean hasAttackDisadvantage(Combatant target) {
        return hasCondition(Condition.POISONED)
                || hasCondition(Condition.PRONE)
                || hasCondition(Condition.BLINDED)
                || hasCondition(Condition.FRIGHTENED)
                || hasCondition(Condition.RESTRAINED)
                || target.isHiddenFrom(this);
    }

    /** End every mark that grants advantage on the next attack against this combatant. */
    public void consumeMarks() {
        for (Duration d : new ArrayList<>(durations)) {
            if (d.grants(Condition.MARKED)) d.end();
        }
    }

    // Saving throws

    public boolean savingThrow(Ability ability, int dc, SaveType type) {
        return savingThrow(ability, dc, type, false);
    }

    /**
     * Roll a saving throw. Paralyzed and stunned creatures fail Strength and
     * Dexterity saves outright.
     */
    public boolean savingThrow(Ability ability, int dc, SaveType type, boolean advantage) {
        if (isIncapacitated() && (ability == Ability.STRENGTH || ability == Ability.DEXTERITY)) {
            context.getTrace().note(TraceEvent.Type.SAVE, this, ability.getAbbreviation() + " save", null,
                    "automatic failure vs DC " + dc);
            return false;
        }
        boolean adv = advantage || hasSaveAdvantage(ability, type);
        boolean disadv = ability == Ability.DEXTERITY && hasCondition(Condition.RESTRAINED);
        int roll = dice().d20(adv, disadv);
        int total = roll + getAbility(ability);
        if (isSaveProficient(ability)) total += proficiency;
        if (hasCondition(Condition.BLESSED)) total += dice().d4();
        boolean success = total >= dc;
        context.getTrace().record(TraceEvent.Type.SAVE, this, ability.getAbbreviation() + " save", null,
                total, 0, (success ? "success" : "failure") + " vs DC " + dc);
        return success;
    }

    private boolean hasSaveAdvantage(Ability ability, SaveType type) {
        switch (type) {
            case CHARM:
                return hasFeature(Feature.CHARM_ADVANTAGE);
            case POISON:
                return hasFeature(Feature.POISON_ADVANTAGE);
            case MAGIC:
                return hasFeature(Feature.MAGIC_RESISTANCE)
                        || (hasFeature(Feature.GNOME_CUNNING) && ability.isMental());
            default:
                return false;
        }
    }

    /**
     * Save against damage. A success halves it (or negates it, when
     * {@code halfOnSuccess} is false); Evasion turns a Dexterity save for half
     * into nothing on a success and half on a failure.
     * @return hit points actually lost
     */
    public int savingThrowForDamage(Ability ability, int dc, SaveType type, Damage damage,
                                    boolean halfOnSuccess, Combatant source) {
        boolean saved = savingThrow(ability, dc, type);
        Damage taken;
        if (halfOnSuccess && ability == Ability.DEXTERITY && hasFeature(Feature.EVASION)) {
            taken = saved ? null : damage.half();
        } else if (saved) {
            taken = halfOnSuccess ? damage.half() : null;
        } else {
            taken = damage;
        }
        return taken == null ? 0 : takeDamage(taken, source, false);
    }

    // Damage and healing

    public boolean isImmuneTo(DamageType type) {
        return immunities.contains(type);
    }

    public boolean isResistantTo(DamageType type) {
        return resistances.contains(type);
    }

    public boolean isVulnerableTo(DamageType type) {
        return vulnerabilities.contains(type);
    }

    /** Damage of one type after Heavy Armor Master, resistance, vulnerability and immunity. */
    public int adjustDamage(int amount, DamageType type) {
        if (type.isPhysical() && hasFeature(Feature.HEAVY_ARMOR_MASTER)) {
            amount -= 3;
        }
        if (resistances.contains(type)) amount /= 2;
        if (vulnerabilities.contains(type)) amount *= 2;
        if (amount <= 0 || immunities.contains(type)) {
            return 0;
        }
        return amount;
    }

    /**
     * Lose hit points. Breaks concentration on a failed save, ends any effect
     * that damage ends, and drops the combatant to unconscious at 0.
     * @param fromAttack whether the damage comes from an attack roll
     * @return hit points actually lost
     */
    public int takeDamage(Damage damage, Combatant source, boolean fromAttack) {
        Damage incoming = modifyIncomingDamage(damage, source, fromAttack);
        int total = 0;
        for (Damage.Part part : incoming.getParts()) {
            total += adjustDamage(part.getAmount(), part.getType());
        }
        int before = hitPoints;
        hitPoints = Math.max(0, hitPoints - total);
        context.getTrace().record(TraceEvent.Type.DAMAGE, source, null, this, null, hitPoints - before,
                incoming.toString());

        if (total > 0) {
            for (Duration d : new ArrayList<>(durations)) {
                if (d.endsOnDamage()) d.end();
            }
            for (Duration d : new ArrayList<>(keptDurations)) {
                d.onKeeperDamaged(total, source);
            }
        }
        if (hitPoints == 0 && before > 0) {
            if (!preventDropping(incoming, total)) {
                fallUnconscious();
            }
        } else if (hitPoints > 0 && total > 0 && concentration != null) {
            int dc = Math.max(10, total / 2);
            if (!savingThrow(Ability.CONSTITUTION, dc, SaveType.ORDINARY, hasFeature(Feature.WAR_CASTER))) {
                endConcentration();
            }
        }
        checkHitPoints();
        return before - hitPoints;
    }

    /** Adjust damage before resistances; Uncanny Dodge hooks in here. */
    protected Damage modifyIncomingDamage(Damage damage, Combatant source, boolean fromAttack) {
        return damage;
    }

    /**
     * Called when damage would drop this combatant to 0.
     * @return true if the combatant stays up (its hit points set by the override)
     */
    protected boolean preventDropping(Damage damage, int total) {
        return false;
    }

    protected void fallUnconscious() {
        if (deathWard) {
            deathWard = false;
            hitPoints = 1;
            context.getTrace().record(TraceEvent.Type.ABILITY, this, "Death Ward", null, null, 1, null);
            return;
        }
        prone = true;
        endConcentration();
        context.getTrace().note(TraceEvent.Type.CONDITION, this, "Unconscious", null, null);
        releaseOnFalling();
    }

    /** Drop straight to 0 without a save (Destroy Undead). */
    public void destroy() {
        int before = hitPoints;
        hitPoints = 0;
        prone = true;
        endConcentration();
        context.getTrace().record(TraceEvent.Type.DAMAGE, (String) null, "Destroyed", name, null, -before, null);
        releaseOnFalling();
    }

    private void releaseOnFalling() {
        for (Duration d : new ArrayList<>(keptDurations)) {
            if (d.endsWhenKeeperFalls()) d.end();
        }
    }

    /**
     * Regain hit points, never beyond the maximum.
     * @return hit points actually regained
     */
    public int heal(int amount, Combatant source) {
        if (amount <= 0) return 0;
        int before = hitPoints;
        hitPoints = Math.min(maxHitPoints, hitPoints + amount);
        context.getTrace().record(TraceEvent.Type.HEAL, source, null, this, null, hitPoints - before, null);
        checkHitPoints();
        return hitPoints - before;
    }

    /**
     * Raise maximum and current hit points by the same amount. Aid does not stack.
     * @return false if already aided
     */
    public boolean grantAid(int amount) {
        if (aidBonus > 0 || amount <= 0) return false;
        aidBonus = amount;
        maxHitPoints += amount;
        hitPoints += amount;
        context.getTrace().record(TraceEvent.Type.HEAL, (String) null, "Aid", name, null, amount, null);
        checkHitPoints();
        return true;
    }

    public boolean isAided() { return aidBonus > 0; }

    protected void setHitPoints(int hitPoints) {
        this.hitPoints = hitPoints;
        checkHitPoints();
    }

    private void checkHitPoints() {
        if (hitPoints < 0 || hitPoints > maxHitPoints) {
            throw new IllegalStateException(name + " has " + hitPoints + " hp, outside [0, " + maxHitPoints + "]");
        }
    }

    public int getHitPoints() { return hitPoints; }

    public int getMaxHitPoints() { return maxHitPoints; }

    public boolean isConscious() { return hitPoints > 0; }

    public int getHitDieSides() { return hitDieSides; }

    public int getHitDiceRemaining() { return hitDiceRemaining; }

    /** Spend one hit die and heal its roll plus Constitution. */
    protected boolean spendHitDie() {
        if (hitDiceRemaining <= 0) return false;
        hitDiceRemaining--;
        int roll = dice().roll(hitDieSides);
        heal(roll + getAbility(Ability.CONSTITUTION), this);
        return true;
    }

    public void grantDeathWard() {
        deathWard = true;
    }

    public boolean hasDeathWard() { return deathWard; }

    // Conditions and durations

    public boolean hasCondition(Condition condition) {
        if (condition == Condition.PRONE) return prone;
        for (Duration d : durations) {
            if (d.grants(condition)) return true;
        }
        return false;
    }

    public boolean isIncapacitated() {
        return hasCondition(Condition.PARALYZED) || hasCondition(Condition.STUNNED);
    }

    public void knockProne() {
        if (!prone) {
            prone = true;
            context.getTrace().note(TraceEvent.Type.CONDITION, this, "Prone", null, null);
        }
    }

    /** @return the creature that has swallowed this one, or null */
    public Combatant getSwallower() {
        for (Duration d : durations) {
            if (d.grants(Condition.SWALLOWED)) return d.getKeeper();
        }
        return null;
    }

    public boolean isSwallowed() {
        return getSwallower() != null;
    }

    /** Creatures this combatant holds under a condition, e.g. the ones it grapples. */
    public List<Combatant> getHeld(Condition condition) {
        List<Combatant> held = new ArrayList<>();
        for (Duration d : keptDurations) {
            if (d.grants(condition) && !held.contains(d.getBearer())) held.add(d.getBearer());
        }
        return held;
    }

    /** End what this combatant keeps on {@code target} that grants the condition; on everyone if null. */
    public void release(Combatant target, Condition condition) {
        for (Duration d : new ArrayList<>(keptDurations)) {
            if (d.grants(condition) && (target == null || d.getBearer() == target)) d.end();
        }
    }

    public boolean isUndead() { return undeadRating != null; }

    public Double getUndeadRating() { return undeadRating; }

    public boolean isConstruct() { return construct; }

    /** Put a duration on this combatant and start its keeper's clock. */
    public void attach(Duration duration) {
        durations.add(duration);
        Combatant keeper = duration.getKeeper();
        if (keeper != null && !keeper.keptDurations.contains(duration)) {
            keeper.keptDurations.add(duration);
        }
        context.getTrace().note(TraceEvent.Type.CONDITION, duration.getKeeper(), duration.getSource(), this, "applied");
        duration.onApply();
    }

    /** Remove a duration; called when it ends. */
    public void detach(Duration duration) {
        durations.remove(duration);
        Combatant keeper = duration.getKeeper();
        if (keeper != null) {
            keeper.keptDurations.remove(duration);
        }
        if (duration == concentration) {
            concentration = null;
        }
    }

    public List<Duration> getDurations() {
        return Collections.unmodifiableList(durations);
    }

    public <T extends Duration> List<T> getDurations(Class<T> type) {
        List<T> matching = new ArrayList<>();
        for (Duration d : durations) {
            if (type.isInstance(d)) matching.add(type.cast(d));
        }
        return matching;
    }

    public boolean hasDuration(Class<? extends Duration> type) {
        for (Duration d : durations) {
            if (type.isInstance(d)) return true;
        }
        return false;
    }

    // Concentration

    /** Start concentrating, ending any spell concentrated on before. */
    public void beginConcentration(ConcentrationEffect effect) {
        endConcentration();
        concentration = effect;
        attach(effect);
    }

    public void endConcentration() {
        if (concentration != null) {
            concentration.end();
            concentration = null;
        }
    }

    public boolean isConcentrating() { return concentration != null; }

    public ConcentrationEffect getConcentration() { return concentration; }

    // Resources

    protected void addResource(LimitedResource resource) {
        resources.put(resource.getName(), resource);
    }

    public LimitedResource getResource(String resourceName) {
        return resources.get(resourceName);
    }

    public boolean hasResource(String resourceName) {
        LimitedResource r = resources.get(resourceName);
        return r != null && r.isAvailable();
    }

    public Collection<LimitedResource> getResources() {
        return Collections.unmodifiableCollection(resources.values());
    }

    // Utilities

    public CombatContext getContext() { return context; }

    protected DiceRoller dice() {
        return context.getDice();
    }

    protected CombatTrace trace() {
        return context.getTrace();
    }

    @Override
    public String toString() {
        return name + " (" + hitPoints + "/" + maxHitPoints + " hp)";
    }
}
