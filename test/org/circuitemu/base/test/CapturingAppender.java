package org.circuitemu.base.test;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;

/**
 * Appender that records the messages logged to one logger, for tests that
 * check what gets logged.
 */
public final class CapturingAppender extends AbstractAppender
{
  private final List<String> mMessages = new ArrayList<>();
  private final Logger mLogger;

  private CapturingAppender(Logger xiLogger)
  {
    super("Capture-" + xiLogger.getName(), null, null, true, Property.EMPTY_ARRAY);
    mLogger = xiLogger;
  }

  /**
   * Start capturing messages logged by the specified class.
   *
   * @param xiClass - the class whose logger to attach to.
   *
   * @return the appender.  Call {@link #detach()} when done.
   */
  public static CapturingAppender attach(Class<?> xiClass)
  {
    CapturingAppender lAppender = new CapturingAppender((Logger)LogManager.getLogger(xiClass));
    lAppender.start();
    lAppender.mLogger.addAppender(lAppender);
    return lAppender;
  }

  public void detach()
  {
    mLogger.removeAppender(this);
    stop();
  }

  @Override
  public synchronized void append(LogEvent xiEvent)
  {
    mMessages.add(xiEvent.getLevel() + " " + xiEvent.getMessage().getFormattedMessage());
  }

  /**
   * @return the messages captured at the specified level, in order.
   *
   * @param xiLevel - the level.
   */
  public synchronized List<String> getMessages(Level xiLevel)
  {
    List<String> lMatching = new ArrayList<>();
    for (String lMessage : mMessages)
    {
      if (lMessage.startsWith(xiLevel + " "))
      {
        lMatching.add(lMessage.substring(xiLevel.toString().length() + 1));
      }
    }
    return lMatching;
  }

  public synchronized void clear()
  {
    mMessages.clear();
  }
}
