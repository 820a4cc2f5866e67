package jstoch.model;

import java.util.*;

import jstoch.logging.*;

/**
 * Drives a {@link DiscreteTimeModel} one day at a time.
 * 
 * Each step runs the model for the next day, hands the result to the
 * periodic loggers in the order they were added, and then asks the model
 * whether it is finished. A failed step terminates the simulator; it cannot
 * be resumed.
 */
public class DiscreteTimeSimulator implements Simulator
{
	private Phase phase = Phase.Initializing;
	
	private DiscreteTimeModel model;
	private List<PeriodicLogger> periodicLoggers;
	
	private int day;
	
	public DiscreteTimeSimulator(DiscreteTimeModel model)
	{
		this.model = model;
		day = 0;
		periodicLoggers = new ArrayList<PeriodicLogger>();
	}
	
	public void start() throws SimulationException
	{
		if(phase != Phase.Initializing) return;
		
		try
		{
			model.initialize();
			for(PeriodicLogger logger : periodicLoggers)
				logger.logStart(model);
		}
		catch(LoggingException e)
		{
			abort();
			throw new SimulationException("Logging exception thrown", e);
		}
		catch(SimulationException e)
		{
			abort();
			throw e;
		}
		
		phase = Phase.Running;
	}
	
	public int performNextStep() throws SimulationException
	{
		if(phase == Phase.Terminated) throw new SimulationException("Already finished.", day);
		start();
		
		int nextDay = day + 1;
		try
		{
			model.step(nextDay);
		}
		catch(SimulationException e)
		{
			abort();
			throw e;
		}
		catch(RuntimeException e)
		{
			abort();
			throw e;
		}
		day = nextDay;
		
		try
		{
			logPeriodic(day);
		}
		catch(LoggingException e)
		{
			abort();
			throw new SimulationException("Logging exception thrown", day, e);
		}
		
		if(model.isFinished(day))
			finish();
		
		return day;
	}
	
	public int runUntil(int endDay) throws SimulationException
	{
		start();
		while(phase == Phase.Running && day < endDay)
			performNextStep();
		return day;
	}
	
	public int runToCompletion() throws SimulationException
	{
		return runUntil(Integer.MAX_VALUE);
	}
	
	public void finish() throws SimulationException
	{
		if(phase == Phase.Terminated) return;
		start();
		
		phase = Phase.Terminated;
		try
		{
			for(PeriodicLogger logger : periodicLoggers)
				logger.logEnd(model);
		}
		catch(LoggingException e)
		{
			throw new SimulationException("Logging exception thrown", day, e);
		}
		finally
		{
			model.finish();
		}
	}
	
	/**
	 * Stops a run before the model is finished. Loggers are not told the run
	 * ended, and the simulator cannot be resumed.
	 */
	public void cancel()
	{
		if(phase == Phase.Terminated) return;
		abort();
	}
	
	/**
	 * Terminates after a failure. The failure itself is rethrown by the
	 * caller, so a model that also fails to finish is only reported.
	 */
	private void abort()
	{
		phase = Phase.Terminated;
		try
		{
			model.finish();
		}
		catch(SimulationException e)
		{
			System.err.println("Model failed to finish after an aborted step: " + e.getMessage());
		}
	}
	
	public Phase getPhase()
	{
		return phase;
	}
	
	public int getDay()
	{
		return day;
	}
	
	public void addPeriodicLogger(PeriodicLogger logger)
	{
		periodicLoggers.add(logger);
	}
	
	private void logPeriodic(int day) throws LoggingException
	{
		for(PeriodicLogger logger : periodicLoggers)
		{
			if(day >= logger.getNextLogDay(model))
				logger.logPeriodic(model, day);
		}
	}
}
