package com.vexrobotics.aimconnector;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Client for one AIM robot. Construction connects the four channels, starts
 * their workers and waits for the first status message; it returns on success,
 * or prints help and exits the program when the robot cannot be reached.
 * <p>
 * Movement and status methods live here; the screen, inertial sensor, kicker,
 * sound, LEDs and AI vision sensor are reached through their getters.
 */
public class Robot implements AutoCloseable {
    static final Log LOG = Log.getLogger(Robot.class);

    public static final String VERSION = "1.0.1.0";

    static final int DRIVE_VELOCITY_MAX_MMPS = 200;
    static final int TURN_VELOCITY_MAX_DPS = 180;

    // Kicker zone in camera pixels: where a held barrel or ball shows up.
    static final int BARREL_MIN_Y = 160;
    static final int BARREL_MIN_CX = 120;
    static final int BARREL_MAX_CX = 200;
    static final int BALL_MIN_Y = 170;
    static final int BALL_MIN_CX = 120;
    static final int BALL_MAX_CX = 200;

    public enum TurnDirection { LEFT, RIGHT }

    public enum DriveUnits { PERCENT, MMPS }

    public enum TurnUnits { PERCENT, DPS }

    /** Stand-in for System.exit, replaced in tests. */
    public interface ExitHandler {
        void exit(int status);
    }

    private final String host;
    private final ClientSettings settings;
    private final TransportFactory transports;
    private final ExitHandler exitHandler;
    private final CancellationToken token = new CancellationToken();
    private final ShadowFlags shadowFlags;
    private final StatusWorker statusWorker;
    private final ImageWorker imageWorker;
    private final CommandWorker commandWorker;
    private final AudioWorker audioWorker;
    private final StateWaiter waiter;
    private final Thread owner;
    private final Thread shutdownHook;
    private volatile boolean shuttingDown = false;

    private volatile int driveSpeed = 100; // mm/s
    private volatile int turnSpeed = 75; // deg/s

    private final Screen screen;
    private final Inertial inertial;
    private final Kicker kicker;
    private final Sound sound;
    private final Led led;
    private final AiVision vision;

    /** Connects to the host named in settings.json. */
    public Robot() {
        this(Settings.load().getHost());
    }

    public Robot(String host) {
        this(host, ClientSettings.defaults(), new WebSocketTransportFactory(), System::exit);
    }

    Robot(String host, ClientSettings settings, TransportFactory transports, ExitHandler exitHandler) {
        this.host = host;
        this.settings = settings;
        this.transports = transports;
        this.exitHandler = exitHandler;
        this.owner = Thread.currentThread();
        System.out.printf("Welcome to the AIM Websocket Java Client. Running version %s and connecting to %s%n", VERSION, host);

        shadowFlags = new ShadowFlags(settings.getShadowConfirmWindow());
        statusWorker = new StatusWorker(host, transports.create(Channel.STATUS), settings, token, shadowFlags);
        imageWorker = new ImageWorker(host, transports.create(Channel.IMAGE), settings, token);
        commandWorker = new CommandWorker(host, transports.create(Channel.COMMAND), settings, token, shadowFlags);
        audioWorker = new AudioWorker(host, transports.create(Channel.AUDIO), settings, token);
        waiter = new StateWaiter(settings, token);

        for (ChannelWorker worker : workers()) connectOrExit(worker);
        for (ChannelWorker worker : workers()) worker.start();

        token.addListener(this::onCancelled);
        shutdownHook = new Thread(this::onJvmShutdown, "aim-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        screen = new Screen(this);
        inertial = new Inertial(this);
        kicker = new Kicker(this);
        sound = new Sound(this);
        led = new Led(this);
        vision = new AiVision(this, imageWorker, settings);

        try {
            send(Commands.programInit());
            waitForFirstStatus();
        } catch (RuntimeException e) {
            // nobody gets a Robot to close, so release the workers and the hook here
            LOG.error("startup failed: {}", e.getMessage());
            close();
            throw e;
        }
        inertial.resetHeading();
    }

    private ChannelWorker[] workers() {
        return new ChannelWorker[] { statusWorker, imageWorker, commandWorker, audioWorker };
    }

    private void connectOrExit(ChannelWorker worker) {
        try {
            worker.connect(settings.getConnectTimeoutMillis());
        } catch (DisconnectedException e) {
            System.out.println(e.getMessage() + ".");
            System.out.printf("Verify that \"%s\" is the correct IP/hostname of the AIM robot and that it is%n", host);
            System.out.println("connected to the same network (AP mode is 192.168.4.1).");
            for (ChannelWorker w : workers()) w.close();
            transports.shutdown();
            exitHandler.exit(1);
            throw e;
        }
    }

    private void waitForFirstStatus() {
        long deadline = System.currentTimeMillis() + settings.getStartupTimeoutMillis();
        while (statusWorker.isCurrentStatusEmpty()) {
            if (System.currentTimeMillis() > deadline || token.isCancelled()) {
                LOG.warn("no status from {} after {} ms", host, settings.getStartupTimeoutMillis());
                return;
            }
            Utilities.sleepMillis(settings.getStatusPeriodMillis());
        }
    }

    private void onJvmShutdown() {
        shuttingDown = true;
        token.cancel("program terminating");
    }

    private void onCancelled() {
        if (!shuttingDown) System.out.println(token.getReason());
        stopWorkers();
        if (!shuttingDown && owner != Thread.currentThread()) owner.interrupt();
        if (settings.isExitOnCancel() && !shuttingDown) exitHandler.exit(0);
    }

    private void stopWorkers() {
        if (imageWorker.isStreaming()) {
            try {
                imageWorker.stopStream();
            } catch (DisconnectedException e) {
                LOG.debug("could not stop image stream: {}", e.getMessage());
            }
        }
        for (ChannelWorker worker : workers()) worker.shutdown();
    }

    /** Stops the workers and closes every channel. */
    @Override
    public void close() {
        shuttingDown = true;
        token.cancel("robot closed");
        for (ChannelWorker worker : workers()) {
            try {
                worker.join(settings.getReconnectDelayMillis() + settings.getReceiveTimeoutMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        transports.shutdown();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            LOG.debug("shutdown already in progress");
        }
    }

    /**
     * Sends a command over the command channel.
     *
     * @throws DisconnectedException if the command channel is down
     */
    CommandResponse send(Command command) {
        if (!commandWorker.isConnected()) {
            throw new DisconnectedException("error calling " + command.getId() + ": not connected to robot");
        }
        return commandWorker.send(command);
    }

    void sendAudio(byte[] payload) {
        if (!audioWorker.isConnected()) {
            throw new DisconnectedException("error uploading audio: not connected to robot");
        }
        audioWorker.sendAudio(payload);
    }

    /** Blocks while {@code state} holds, stopping all movement if it outlasts the timeout. */
    boolean blockOn(String name, BooleanSupplier state) {
        return waiter.blockOn(name, state, this::stopAllMovement);
    }

    public StatusSnapshot getStatus() {
        return statusWorker.getCurrentStatus();
    }

    public String getHost() {
        return host;
    }

    public boolean isConnected() {
        return commandWorker.isConnected();
    }

    public CancellationToken getCancellationToken() {
        return token;
    }

    public Screen getScreen() { return screen; }
    public Inertial getInertial() { return inertial; }
    public Kicker getKicker() { return kicker; }
    public Sound getSound() { return sound; }
    public Led getLed() { return led; }
    public AiVision getVision() { return vision; }

    ShadowFlags getShadowFlags() { return shadowFlags; }
    StatusWorker getStatusWorker() { return statusWorker; }

    // ---- sensing motion ----

    public double getXPosition() {
        StatusSnapshot s = getStatus();
        double offset = -Math.toRadians(inertial.getHeadingOffset());
        return s.getRobotX() * Math.cos(offset) + s.getRobotY() * Math.sin(offset);
    }

    public double getYPosition() {
        StatusSnapshot s = getStatus();
        double offset = -Math.toRadians(inertial.getHeadingOffset());
        return s.getRobotY() * Math.cos(offset) - s.getRobotX() * Math.sin(offset);
    }

    /** True while a moveAt or moveFor is running at nonzero speed. */
    public boolean isMoveActive() {
        return shadowFlags.isSet(RobotFlag.MOVE_ACTIVE, getStatus().getRobotFlags());
    }

    /** True while a turn, turnFor or turnTo is running at nonzero speed. */
    public boolean isTurnActive() {
        return shadowFlags.isSet(RobotFlag.TURN_ACTIVE, getStatus().getRobotFlags());
    }

    /** True when no move, turn or wheel command is driving the wheels. */
    public boolean isStopped() {
        return !shadowFlags.isSet(RobotFlag.MOVING, getStatus().getRobotFlags());
    }

    public int getBatteryCapacity() {
        return getStatus().getBattery();
    }

    // ---- motion ----

    /**
     * Default speed for later moves. Starts at 50% (100 mm/s).
     *
     * @throws IllegalArgumentException for a negative velocity
     */
    public void setMoveVelocity(double velocity) {
        setMoveVelocity(velocity, DriveUnits.PERCENT);
    }

    public void setMoveVelocity(double velocity, DriveUnits units) {
        if (velocity < 0) throw new IllegalArgumentException("velocity must be a positive number");
        driveSpeed = toMmps(velocity, units);
    }

    /** Default rate for later turns. Starts at 75 deg/s. */
    public void setTurnVelocity(double velocity) {
        setTurnVelocity(velocity, TurnUnits.PERCENT);
    }

    public void setTurnVelocity(double velocity, TurnUnits units) {
        if (velocity < 0) throw new IllegalArgumentException("velocity must be a positive number");
        turnSpeed = toDps(velocity, units);
    }

    static int toMmps(double velocity, DriveUnits units) {
        if (units == DriveUnits.PERCENT) return (int) (Math.min(velocity, 100) * 2);
        return (int) Math.min(velocity, DRIVE_VELOCITY_MAX_MMPS);
    }

    static int toDps(double velocity, TurnUnits units) {
        if (units == TurnUnits.PERCENT) return (int) (Math.min(velocity, 100) * 1.8);
        return (int) Math.min(velocity, TURN_VELOCITY_MAX_DPS);
    }

    /** Drives at {@code angle} degrees (-360 to 360) until told otherwise. */
    public void moveAt(double angle) {
        send(Commands.drive(angle, driveSpeed));
    }

    public void moveAt(double angle, double velocity, DriveUnits units) {
        send(Commands.drive(angle, toMmps(velocity, units)));
    }

    /** Drives {@code distance} mm at {@code angle} degrees and waits for the move to end. */
    public void moveFor(double distance, double angle) {
        moveFor(distance, angle, driveSpeed, DriveUnits.MMPS, true);
    }

    public void moveFor(double distance, double angle, double velocity, DriveUnits units, boolean wait) {
        int speed = toMmps(velocity, units);
        if (speed < 0) {
            speed = -speed;
            distance = -distance;
        }
        send(Commands.driveFor(distance, angle, speed, turnSpeed, 0));
        if (wait) blockOn("isMoveActive", this::isMoveActive);
    }

    /**
     * Holonomic drive from percent velocities: forwards (+y), rightwards (+x) and
     * clockwise rotation, each clipped to -100..100.
     */
    public void moveWithVectors(double forwards, double rightwards, double rotation) {
        double x = clip(rightwards) * 2.0;
        double y = clip(forwards) * 2.0;
        double r = clip(rotation) * 1.8;
        double w1 = (0.5 * x) + (0.866 * y) + r;
        double w2 = (0.5 * x) - (0.866 * y) + r;
        double w3 = r - x;
        spinWheels((int) w1, (int) w2, (int) w3);
    }

    private static double clip(double percent) {
        return Math.max(-100, Math.min(100, percent));
    }

    public void turn(TurnDirection direction) {
        send(Commands.turn(direction == TurnDirection.LEFT ? -turnSpeed : turnSpeed));
    }

    public void turn(TurnDirection direction, double velocity, TurnUnits units) {
        int rate = toDps(velocity, units);
        send(Commands.turn(direction == TurnDirection.LEFT ? -rate : rate));
    }

    public void turnFor(TurnDirection direction, double angle) {
        turnFor(direction, angle, turnSpeed, TurnUnits.DPS, true);
    }

    public void turnFor(TurnDirection direction, double angle, double velocity, TurnUnits units, boolean wait) {
        int rate = toDps(velocity, units);
        send(Commands.turnFor(direction == TurnDirection.LEFT ? -angle : angle, rate));
        if (wait) blockOn("isTurnActive", this::isTurnActive);
    }

    public void turnTo(double heading) {
        turnTo(heading, turnSpeed, TurnUnits.DPS, true);
    }

    /**
     * @throws IllegalArgumentException unless -360 &lt; heading &lt; 360
     */
    public void turnTo(double heading, double velocity, TurnUnits units, boolean wait) {
        if (!(heading > -360 && heading < 360)) throw new IllegalArgumentException("heading must be between -360 and 360");
        int rate = Math.abs(toDps(velocity, units));
        double target = (inertial.getHeadingOffset() + heading) % 360;
        send(Commands.turnTo(target, rate));
        if (wait) blockOn("isTurnActive", this::isTurnActive);
    }

    public void stopAllMovement() {
        moveAt(0, 0, DriveUnits.PERCENT);
        turn(TurnDirection.RIGHT, 0, TurnUnits.PERCENT);
        shadowFlags.release(RobotFlag.MOVE_ACTIVE);
        shadowFlags.release(RobotFlag.TURN_ACTIVE);
        shadowFlags.requestClear(RobotFlag.MOVING);
    }

    public void spinWheels(int velocity1, int velocity2, int velocity3) {
        send(Commands.spinWheels(velocity1, velocity2, velocity3));
    }

    /** Redefines the current position, then waits until status reflects it. */
    public void setXyPosition(double x, double y) {
        double offset = -Math.toRadians(inertial.getHeadingOffset());
        double originX = x * Math.cos(offset) - y * Math.sin(offset);
        double originY = y * Math.cos(offset) + x * Math.sin(offset);
        send(Commands.setPose(originX, originY));
        if (!statusWorker.awaitSnapshots(2, settings.getBlockTimeoutMillis())) {
            LOG.warn("position update not confirmed by status");
        }
    }

    // ---- kicker zone ----

    public boolean hasAnyBarrel() {
        return holds(BARREL_MIN_CX, BARREL_MAX_CX, BARREL_MIN_Y, "BlueBarrel", "OrangeBarrel");
    }

    public boolean hasBlueBarrel() {
        return holds(BARREL_MIN_CX, BARREL_MAX_CX, BARREL_MIN_Y, "BlueBarrel");
    }

    public boolean hasOrangeBarrel() {
        return holds(BARREL_MIN_CX, BARREL_MAX_CX, BARREL_MIN_Y, "OrangeBarrel");
    }

    public boolean hasSportsBall() {
        return holds(BALL_MIN_CX, BALL_MAX_CX, BALL_MIN_Y, "SportsBall");
    }

    // Uses its own pipeline so the result of the program's last getData is kept.
    private boolean holds(int minCx, int maxCx, int minY, String... classNames) {
        List<DetectedObject> models = new PerceptionPipeline().query(getStatus().getVision(),
                Collections.singletonList(VisionObjects.ALL_MODELS), PerceptionPipeline.DEFAULT_COUNT);
        for (DetectedObject object : models) {
            String name = ((DetectedObject.ModelObject) object).getClassName();
            double cx = object.getOriginX() + object.getWidth() / 2.0;
            if (cx > minCx && cx < maxCx && object.getOriginY() > minY) {
                for (String wanted : classNames) {
                    if (wanted.equals(name)) return true;
                }
            }
        }
        return false;
    }

    // ---- events ----

    public void onScreenPressed(Runnable callback) {
        statusWorker.addScreenPressedCallback(callback);
    }

    public void onScreenReleased(Runnable callback) {
        statusWorker.addScreenReleasedCallback(callback);
    }

    public void onCrash(Runnable callback) {
        statusWorker.addCrashCallback(callback);
    }

    public void setStatusListener(Consumer<StatusSnapshot> listener) {
        statusWorker.setStatusListener(listener);
    }

    /**
     * Returns {@code parameter} limited to [min, max], warning once per distinct
     * out-of-range call.
     */
    static int clampParameterToBounds(int parameter, int min, int max, String func, String paramName) {
        if (parameter < min || parameter > max) {
            warn(String.format("When calling `%s(...)`, using %d for %s is invalid. It must be an int between %d and %d, inclusive.",
                    func, parameter, paramName, min, max));
            return Math.max(min, Math.min(max, parameter));
        }
        return parameter;
    }

    private static final Set<String> alreadyWarned = new HashSet<>();

    static void warn(String message) {
        synchronized (alreadyWarned) {
            if (!alreadyWarned.add(message)) return;
        }
        LOG.warn(message);
    }

    /** Pauses the program for a time in seconds. */
    public static void delay(double numSeconds) {
        Utilities.sleepMillis(Math.round(1000 * numSeconds));
    }
}
