package org.nowstart.trendband.position;

import org.nowstart.trendband.data.type.ExitReason;

public record PositionDecision(
        Action action,
        OpenPosition position,
        ExitReason exitReason,
        double exitPrice,
        String detail
) {

    public enum Action {
        HOLD,
        EXIT,
        ADD_LEG
    }

    public static PositionDecision hold(OpenPosition position) {
        return new PositionDecision(Action.HOLD, position, null, Double.NaN, "HOLD");
    }

    public static PositionDecision exit(OpenPosition position, ExitReason reason, double exitPrice, String detail) {
        return new PositionDecision(Action.EXIT, position, reason, exitPrice, detail);
    }

    public static PositionDecision addLeg(OpenPosition position, String detail) {
        return new PositionDecision(Action.ADD_LEG, position, null, Double.NaN, detail);
    }

    public boolean isExit() {
        return action == Action.EXIT;
    }

    public boolean isAddLeg() {
        return action == Action.ADD_LEG;
    }
}
