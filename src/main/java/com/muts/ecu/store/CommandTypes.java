package com.muts.ecu.store;

/**
 * Command type names understood by the processor.
 *
 * <p>Types marked internal are only enqueued by the pipeline itself.</p>
 */
public final class CommandTypes
{
    private CommandTypes() {}

    public static final String CONNECTION_CONNECT = "connection:connect";
    public static final String CONNECTION_DISCONNECT = "connection:disconnect";

    public static final String TELEMETRY_START = "telemetry:start";
    public static final String TELEMETRY_STOP = "telemetry:stop";
    /** Internal: one polling tick. */
    public static final String TELEMETRY_SAMPLE = "telemetry:sample";

    public static final String DIAGNOSTICS_SCAN = "diagnostics:scan";

    public static final String SAFETY_ARM = "safety:arm";
    public static final String SAFETY_DISARM = "safety:disarm";

    public static final String SESSION_CREATE = "session:create";
    public static final String SESSION_ARM = "session:arm";
    public static final String SESSION_APPLY = "session:apply";
    /** Internal: write the next pending change. */
    public static final String SESSION_APPLY_STEP = "session:apply-step";
    public static final String SESSION_CANCEL = "session:cancel";
    /** Internal: periodic expiry sweep. */
    public static final String SESSION_EXPIRE_SWEEP = "session:expire-sweep";

    public static final String FLASH_PREPARE = "flash:prepare";
    public static final String FLASH_BACKUP = "flash:backup";
    public static final String FLASH_START = "flash:start";
    /** Internal: write the next image block. */
    public static final String FLASH_BLOCK = "flash:block";
    /** Internal: read back and compare the written image. */
    public static final String FLASH_VERIFY = "flash:verify";
    public static final String FLASH_ABORT = "flash:abort";
}
