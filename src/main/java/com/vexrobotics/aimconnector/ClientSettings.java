package com.vexrobotics.aimconnector;

/**
 * Timing and policy knobs for one robot client. The defaults match the robot's
 * firmware cadence; tests shrink them.
 */
public final class ClientSettings {

    /** What to do when the robot answers a command with status "error". */
    public enum RejectedCommandPolicy { LOG, THROW }

    private final long connectTimeoutMillis;
    private final long receiveTimeoutMillis;
    private final long statusPeriodMillis;
    private final int maxLostPackets;
    private final long reconnectDelayMillis;
    private final long commandCycleMillis;
    private final long imageIdleMillis;
    private final long imageWaitMillis;
    private final long imagePollMillis;
    private final long blockTimeoutMillis;
    private final long blockPollMillis;
    private final long blockDebounceMillis;
    private final long startupTimeoutMillis;
    private final int shadowConfirmWindow;
    private final RejectedCommandPolicy rejectedCommandPolicy;
    private final boolean exitOnCancel;

    private ClientSettings(Builder b) {
        connectTimeoutMillis = b.connectTimeoutMillis;
        receiveTimeoutMillis = b.receiveTimeoutMillis;
        statusPeriodMillis = b.statusPeriodMillis;
        maxLostPackets = b.maxLostPackets;
        reconnectDelayMillis = b.reconnectDelayMillis;
        commandCycleMillis = b.commandCycleMillis;
        imageIdleMillis = b.imageIdleMillis;
        imageWaitMillis = b.imageWaitMillis;
        imagePollMillis = b.imagePollMillis;
        blockTimeoutMillis = b.blockTimeoutMillis;
        blockPollMillis = b.blockPollMillis;
        blockDebounceMillis = b.blockDebounceMillis;
        startupTimeoutMillis = b.startupTimeoutMillis;
        shadowConfirmWindow = b.shadowConfirmWindow;
        rejectedCommandPolicy = b.rejectedCommandPolicy;
        exitOnCancel = b.exitOnCancel;
    }

    public static ClientSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getConnectTimeoutMillis() { return connectTimeoutMillis; }
    public long getReceiveTimeoutMillis() { return receiveTimeoutMillis; }
    public long getStatusPeriodMillis() { return statusPeriodMillis; }
    public int getMaxLostPackets() { return maxLostPackets; }
    public long getReconnectDelayMillis() { return reconnectDelayMillis; }
    public long getCommandCycleMillis() { return commandCycleMillis; }
    public long getImageIdleMillis() { return imageIdleMillis; }
    public long getImageWaitMillis() { return imageWaitMillis; }
    public long getImagePollMillis() { return imagePollMillis; }
    public long getBlockTimeoutMillis() { return blockTimeoutMillis; }
    public long getBlockPollMillis() { return blockPollMillis; }
    public long getBlockDebounceMillis() { return blockDebounceMillis; }
    public long getStartupTimeoutMillis() { return startupTimeoutMillis; }
    public int getShadowConfirmWindow() { return shadowConfirmWindow; }
    public RejectedCommandPolicy getRejectedCommandPolicy() { return rejectedCommandPolicy; }
    public boolean isExitOnCancel() { return exitOnCancel; }

    public static final class Builder {
        private long connectTimeoutMillis = 4000;
        private long receiveTimeoutMillis = 4000;
        private long statusPeriodMillis = 50;
        private int maxLostPackets = 5;
        private long reconnectDelayMillis = 200;
        private long commandCycleMillis = 200;
        private long imageIdleMillis = 50;
        private long imageWaitMillis = 500;
        private long imagePollMillis = 10;
        private long blockTimeoutMillis = 10000;
        private long blockPollMillis = 100;
        private long blockDebounceMillis = 50;
        private long startupTimeoutMillis = 10000;
        private int shadowConfirmWindow = 10;
        private RejectedCommandPolicy rejectedCommandPolicy = RejectedCommandPolicy.LOG;
        private boolean exitOnCancel = true;

        private Builder() { }

        public Builder connectTimeoutMillis(long v) { connectTimeoutMillis = v; return this; }
        public Builder receiveTimeoutMillis(long v) { receiveTimeoutMillis = v; return this; }
        public Builder statusPeriodMillis(long v) { statusPeriodMillis = v; return this; }
        public Builder maxLostPackets(int v) { maxLostPackets = v; return this; }
        public Builder reconnectDelayMillis(long v) { reconnectDelayMillis = v; return this; }
        public Builder commandCycleMillis(long v) { commandCycleMillis = v; return this; }
        public Builder imageIdleMillis(long v) { imageIdleMillis = v; return this; }
        public Builder imageWaitMillis(long v) { imageWaitMillis = v; return this; }
        public Builder imagePollMillis(long v) { imagePollMillis = v; return this; }
        public Builder blockTimeoutMillis(long v) { blockTimeoutMillis = v; return this; }
        public Builder blockPollMillis(long v) { blockPollMillis = v; return this; }
        public Builder blockDebounceMillis(long v) { blockDebounceMillis = v; return this; }
        public Builder startupTimeoutMillis(long v) { startupTimeoutMillis = v; return this; }
        public Builder shadowConfirmWindow(int v) { shadowConfirmWindow = v; return this; }
        public Builder rejectedCommandPolicy(RejectedCommandPolicy v) { rejectedCommandPolicy = v; return this; }
        public Builder exitOnCancel(boolean v) { exitOnCancel = v; return this; }

        public ClientSettings build() {
            if (maxLostPackets < 0) throw new IllegalArgumentException("maxLostPackets must be >= 0");
            if (shadowConfirmWindow < 0) throw new IllegalArgumentException("shadowConfirmWindow must be >= 0");
            return new ClientSettings(this);
        }
    }
}
