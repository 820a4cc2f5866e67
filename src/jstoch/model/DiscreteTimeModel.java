package jstoch.model;

/**
 * A model advanced in whole time steps (days). The simulator calls
 * {@link #initialize()} once, then {@link #step(int)} for days 1, 2, ...
 * until {@link #isFinished(int)} answers true, then {@link #finish()}.
 */
public interface DiscreteTimeModel
{
	public void initialize() throws SimulationException;
	public void step(int day) throws SimulationException;
	public boolean isFinished(int day);
	public void finish() throws SimulationException;
}
