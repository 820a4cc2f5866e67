package sejirs;

import java.util.*;

import jstoch.logging.*;
import jstoch.model.*;

/**
 * Entry point for running one simulation from a validated parameter
 * bundle. A simulation runs once: either to completion with {@link #run()}
 * or day by day through {@link #days()}.
 */
public class EpidemicSimulation
{
	private final EpidemicModel model;
	private final OutputRecorder recorder;
	private final DiscreteTimeSimulator simulator;
	
	private boolean used = false;
	
	public EpidemicSimulation(Parameters params)
	{
		model = new EpidemicModel(params);
		recorder = new OutputRecorder(model);
		simulator = new DiscreteTimeSimulator(model);
		simulator.addPeriodicLogger(recorder);
	}
	
	/**
	 * Adds a logger that is notified after the recorder.
	 */
	public void addLogger(PeriodicLogger logger)
	{
		simulator.addPeriodicLogger(logger);
	}
	
	/**
	 * Runs until the last day or until the infection has died out.
	 * 
	 * @throws RunAbortedException if a consistency check failed; the rows
	 * recorded up to the previous day are attached
	 */
	public OutputTable run() throws SimulationException
	{
		claim();
		try
		{
			simulator.runToCompletion();
		}
		catch(InvariantViolationException e)
		{
			throw new RunAbortedException(e, recorder.getRecordedRows());
		}
		return recorder.toTable();
	}
	
	/**
	 * Lazily advances the simulation one day per call to {@code next()},
	 * returning that day's rows. Failures surface as
	 * {@link IllegalStateException} with the {@link SimulationException} as
	 * cause. The iterator can be abandoned at any point; {@link #close()}
	 * releases the worker threads at once.
	 */
	public Iterator<List<OutputRow>> days() throws SimulationException
	{
		claim();
		simulator.start();
		
		return new Iterator<List<OutputRow>>()
		{
			public boolean hasNext()
			{
				return simulator.getPhase() == Simulator.Phase.Running;
			}
			
			public List<OutputRow> next()
			{
				if(!hasNext())
					throw new NoSuchElementException("Simulation has ended on day " + simulator.getDay());
				try
				{
					simulator.performNextStep();
				}
				catch(InvariantViolationException e)
				{
					throw new IllegalStateException(new RunAbortedException(e, recorder.getRecordedRows()));
				}
				catch(SimulationException e)
				{
					throw new IllegalStateException(e);
				}
				return recorder.getLastDayRows();
			}
			
			public void remove()
			{
				throw new UnsupportedOperationException();
			}
		};
	}
	
	/**
	 * Ends an unfinished run and releases its worker threads. Recorded rows
	 * stay available; the table does not.
	 */
	public void close()
	{
		simulator.cancel();
	}
	
	private void claim()
	{
		if(used)
			throw new IllegalStateException("Simulation has already been run");
		used = true;
	}
	
	public EpidemicModel getModel()
	{
		return model;
	}
	
	public OutputRecorder getRecorder()
	{
		return recorder;
	}
	
	public DiscreteTimeSimulator getSimulator()
	{
		return simulator;
	}
}
