package ca.gc.cra.metawriter.domain.msg;

/**
 * Field names carried in message headers and bodies.
 *
 * @since 0.1.0
 */
public final class MessageFields {
  /** Frame index written by a producer. */
  public static final String FRAME = "frame";
  /** Storage offset of the frame within the run. */
  public static final String OFFSET = "offset";
  /** Time a producer spent creating its data file. */
  public static final String CREATE_DURATION = "create_duration";
  /** Time a producer spent writing the frame. */
  public static final String WRITE_DURATION = "write_duration";
  /** Time a producer spent flushing the frame. */
  public static final String FLUSH_DURATION = "flush_duration";
  /** Time a producer spent closing its data file. */
  public static final String CLOSE_DURATION = "close_duration";
  /** Header field on start-acquisition carrying the run's total frame count. */
  public static final String TOTAL_FRAMES = "totalFrames";
  /** Header field on stop-acquisition identifying the producer. */
  public static final String RANK = "rank";

  private MessageFields() {}
}
