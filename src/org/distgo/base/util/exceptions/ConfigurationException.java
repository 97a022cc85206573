package org.distgo.base.util.exceptions;

/**
 * Thrown when the process has been configured in a way that it can't run with.
 */
public class ConfigurationException extends Exception
{
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String xiMessage)
  {
    super(xiMessage);
  }

  public ConfigurationException(String xiMessage, Throwable xiCause)
  {
    super(xiMessage, xiCause);
  }
}
