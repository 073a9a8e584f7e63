package com.vexrobotics.aimconnector;

import java.util.EnumMap;
import java.util.Map;

/**
 * Locally predicted values of robot flags. A command that the robot accepted
 * requests a value here; the status worker forces that value into every
 * snapshot until the robot reports it itself (confirmed), the request is
 * released, or it goes unconfirmed for more than the confirmation window.
 */
public class ShadowFlags {
    static final Log LOG = Log.getLogger(ShadowFlags.class);

    public enum State { UNSET, PENDING_SET, PENDING_CLEAR, CONFIRMED }

    private final Map<RobotFlag, State> states = new EnumMap<>(RobotFlag.class);
    private final Map<RobotFlag, Integer> unconfirmed = new EnumMap<>(RobotFlag.class);
    private final int confirmWindow;

    /**
     * @param confirmWindow snapshots a pending value survives without the robot
     *                      agreeing; 0 keeps it until confirmed or released
     */
    public ShadowFlags(int confirmWindow) {
        this.confirmWindow = confirmWindow;
        for (RobotFlag flag : RobotFlag.values()) {
            if (flag.isShadowed()) states.put(flag, State.UNSET);
        }
    }

    public synchronized void requestSet(RobotFlag flag) {
        transition(flag, State.PENDING_SET);
    }

    public synchronized void requestClear(RobotFlag flag) {
        transition(flag, State.PENDING_CLEAR);
    }

    public synchronized void release(RobotFlag flag) {
        transition(flag, State.UNSET);
    }

    public synchronized State state(RobotFlag flag) {
        return stateOf(flag);
    }

    /**
     * Folds the pending values into a freshly decoded flag word. Called once per
     * snapshot by the status worker only.
     */
    public synchronized int apply(int rawFlags) {
        int flags = rawFlags;
        for (Map.Entry<RobotFlag, State> entry : states.entrySet()) {
            State state = entry.getValue();
            if (state != State.PENDING_SET && state != State.PENDING_CLEAR) continue;
            RobotFlag flag = entry.getKey();
            boolean wanted = state == State.PENDING_SET;
            if (flag.isSetIn(rawFlags) == wanted) {
                entry.setValue(State.CONFIRMED);
                unconfirmed.remove(flag);
                continue;
            }
            int age = unconfirmed.getOrDefault(flag, 0) + 1;
            if (confirmWindow > 0 && age > confirmWindow) {
                LOG.debug("{} override lapsed after {} snapshots", flag, confirmWindow);
                entry.setValue(State.UNSET);
                unconfirmed.remove(flag);
                continue;
            }
            unconfirmed.put(flag, age);
            flags = wanted ? flags | flag.mask() : flags & ~flag.mask();
        }
        return flags;
    }

    /** Effective value of a flag: a pending request wins over the reported bit. */
    public synchronized boolean isSet(RobotFlag flag, int flags) {
        switch (stateOf(flag)) {
            case PENDING_SET:
                return true;
            case PENDING_CLEAR:
                return false;
            default:
                return flag.isSetIn(flags);
        }
    }

    private State stateOf(RobotFlag flag) {
        State state = states.get(flag);
        if (state == null) throw new IllegalArgumentException(flag + " is not a shadowed flag");
        return state;
    }

    private void transition(RobotFlag flag, State next) {
        stateOf(flag);
        states.put(flag, next);
        unconfirmed.remove(flag);
    }
}
