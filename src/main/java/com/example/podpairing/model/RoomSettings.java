package com.example.podpairing.model;

import java.time.Duration;

/** Host-controlled settings of a session. */
public class RoomSettings {

    private boolean allowJoinAfterStart = true;
    private boolean prioritizeWinners = true;
    private boolean allowThreeSeatTables = true;
    private boolean extraThreeSeatPenalty = false;
    private boolean allowCustomGroups = true;
    private Duration roundLength = Duration.ofMinutes(90);

    // points schema
    private boolean usePoints = false;
    private int pointsForWin = 3;
    private int pointsForDraw = 1;
    private int pointsForLoss = 0;
    private int pointsForBye = 1;

    private int maxRounds = 0;       // 0 = unlimited
    private int maxTableSize = 4;    // 3 or 4

    private SelectorVariant selectorVariant = SelectorVariant.PROGRESSIVE;

    public boolean isAllowJoinAfterStart() { return allowJoinAfterStart; }
    public void setAllowJoinAfterStart(boolean v) { this.allowJoinAfterStart = v; }

    public boolean isPrioritizeWinners() { return prioritizeWinners; }
    public void setPrioritizeWinners(boolean v) { this.prioritizeWinners = v; }

    public boolean isAllowThreeSeatTables() { return allowThreeSeatTables; }
    public void setAllowThreeSeatTables(boolean v) { this.allowThreeSeatTables = v; }

    public boolean isExtraThreeSeatPenalty() { return extraThreeSeatPenalty; }
    public void setExtraThreeSeatPenalty(boolean v) { this.extraThreeSeatPenalty = v; }

    public boolean isAllowCustomGroups() { return allowCustomGroups; }
    public void setAllowCustomGroups(boolean v) { this.allowCustomGroups = v; }

    public Duration getRoundLength() { return roundLength; }
    public void setRoundLength(Duration roundLength) {
        if (roundLength == null || roundLength.isNegative() || roundLength.isZero()) {
            throw new IllegalArgumentException("roundLength must be positive");
        }
        this.roundLength = roundLength;
    }

    public boolean isUsePoints() { return usePoints; }
    public void setUsePoints(boolean v) { this.usePoints = v; }

    public int getPointsForWin() { return pointsForWin; }
    public void setPointsForWin(int v) { this.pointsForWin = v; }

    public int getPointsForDraw() { return pointsForDraw; }
    public void setPointsForDraw(int v) { this.pointsForDraw = v; }

    public int getPointsForLoss() { return pointsForLoss; }
    public void setPointsForLoss(int v) { this.pointsForLoss = v; }

    public int getPointsForBye() { return pointsForBye; }
    public void setPointsForBye(int v) { this.pointsForBye = v; }

    public int getMaxRounds() { return maxRounds; }
    public void setMaxRounds(int maxRounds) {
        if (maxRounds < 0) throw new IllegalArgumentException("maxRounds must be >= 0");
        this.maxRounds = maxRounds;
    }

    public int getMaxTableSize() { return maxTableSize; }
    public void setMaxTableSize(int maxTableSize) {
        if (maxTableSize < 3 || maxTableSize > 4) {
            throw new IllegalArgumentException("maxTableSize must be 3 or 4");
        }
        this.maxTableSize = maxTableSize;
    }

    public SelectorVariant getSelectorVariant() { return selectorVariant; }
    public void setSelectorVariant(SelectorVariant selectorVariant) {
        this.selectorVariant = (selectorVariant == null) ? SelectorVariant.PROGRESSIVE : selectorVariant;
    }

    public RoomSettings copy() {
        RoomSettings c = new RoomSettings();
        c.allowJoinAfterStart = allowJoinAfterStart;
        c.prioritizeWinners = prioritizeWinners;
        c.allowThreeSeatTables = allowThreeSeatTables;
        c.extraThreeSeatPenalty = extraThreeSeatPenalty;
        c.allowCustomGroups = allowCustomGroups;
        c.roundLength = roundLength;
        c.usePoints = usePoints;
        c.pointsForWin = pointsForWin;
        c.pointsForDraw = pointsForDraw;
        c.pointsForLoss = pointsForLoss;
        c.pointsForBye = pointsForBye;
        c.maxRounds = maxRounds;
        c.maxTableSize = maxTableSize;
        c.selectorVariant = selectorVariant;
        return c;
    }
}
