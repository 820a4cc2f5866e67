package jstoch.logging;

public class LoggingException extends Exception
{
	private static final long serialVersionUID = 1L;
	
	private PeriodicLogger logger;
	
	public LoggingException(PeriodicLogger logger, String message, Throwable cause)
	{
		super(message, cause);
		this.logger = logger;
	}

	public LoggingException(PeriodicLogger logger, String message)
	{
		super(message);
		this.logger = logger;
	}

	public LoggingException(PeriodicLogger logger, Throwable cause)
	{
		super(cause);
		this.logger = logger;
	}
	
	public PeriodicLogger getLogger()
	{
		return logger;
	}
}
