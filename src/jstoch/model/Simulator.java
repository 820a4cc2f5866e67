package jstoch.model;

import jstoch.logging.*;

public interface Simulator
{
	enum Phase
	{
		Initializing,
		Running,
		Terminated
	}
	
	public Phase getPhase();
	public int getDay();
	
	public void start() throws SimulationException;
	public int performNextStep() throws SimulationException;
	public int runUntil(int day) throws SimulationException;
	public int runToCompletion() throws SimulationException;
	public void finish() throws SimulationException;

	public void addPeriodicLogger(PeriodicLogger logger);
}
