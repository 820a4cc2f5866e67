package jstoch.model.test;

import java.util.*;

import jstoch.logging.*;
import jstoch.model.*;

import org.junit.*;

import static org.junit.Assert.*;

public class TestDiscreteTimeSimulator
{
	static class CountingModel implements DiscreteTimeModel
	{
		int lastDay;
		int failOnDay = -1;
		int crashOnDay = -1;
		int endDay;
		boolean initialized;
		int finishCalls;
		List<Integer> steps = new ArrayList<Integer>();
		
		CountingModel(int endDay)
		{
			this.endDay = endDay;
		}
		
		public void initialize() throws SimulationException
		{
			initialized = true;
		}
		
		public void step(int day) throws SimulationException
		{
			if(day == failOnDay)
				throw new InvariantViolationException("test invariant", "unit", day, null);
			if(day == crashOnDay)
				throw new IllegalStateException("crash on day " + day);
			steps.add(day);
			lastDay = day;
		}
		
		public boolean isFinished(int day)
		{
			return day >= endDay;
		}
		
		public void finish() throws SimulationException
		{
			finishCalls++;
		}
	}
	
	static class RecordingLogger implements PeriodicLogger
	{
		int starts;
		int ends;
		int interval;
		int logCount;
		List<Integer> days = new ArrayList<Integer>();
		boolean fail;
		
		RecordingLogger(int interval)
		{
			this.interval = interval;
		}
		
		public void logStart(DiscreteTimeModel model) throws LoggingException
		{
			starts++;
		}
		
		public void logEnd(DiscreteTimeModel model) throws LoggingException
		{
			ends++;
		}
		
		public int getNextLogDay(DiscreteTimeModel model)
		{
			return (logCount + 1) * interval;
		}
		
		public void logPeriodic(DiscreteTimeModel model, int day) throws LoggingException
		{
			if(fail) throw new LoggingException(this, "disk full");
			days.add(day);
			logCount++;
		}
	}
	
	CountingModel model;
	RecordingLogger logger;
	DiscreteTimeSimulator sim;
	
	@Before
	public void setUp() throws Exception
	{
		model = new CountingModel(5);
		logger = new RecordingLogger(1);
		sim = new DiscreteTimeSimulator(model);
		sim.addPeriodicLogger(logger);
	}
	
	@Test
	public void runsToCompletion() throws Exception
	{
		assertEquals(Simulator.Phase.Initializing, sim.getPhase());
		
		int day = sim.runToCompletion();
		assertEquals(5, day);
		assertEquals(Arrays.asList(1, 2, 3, 4, 5), model.steps);
		assertEquals(Arrays.asList(1, 2, 3, 4, 5), logger.days);
		assertEquals(Simulator.Phase.Terminated, sim.getPhase());
		assertTrue(model.initialized);
		assertEquals(1, model.finishCalls);
		assertEquals(1, logger.starts);
		assertEquals(1, logger.ends);
	}
	
	@Test
	public void runUntilStopsEarly() throws Exception
	{
		assertEquals(3, sim.runUntil(3));
		assertEquals(Simulator.Phase.Running, sim.getPhase());
		assertEquals(0, logger.ends);
		
		sim.finish();
		sim.finish();
		assertEquals(Simulator.Phase.Terminated, sim.getPhase());
		assertEquals(1, logger.ends);
		assertEquals(1, model.finishCalls);
	}
	
	@Test
	public void loggerInterval() throws Exception
	{
		RecordingLogger sparse = new RecordingLogger(2);
		sim.addPeriodicLogger(sparse);
		sim.runToCompletion();
		assertEquals(Arrays.asList(2, 4), sparse.days);
	}
	
	@Test(expected=SimulationException.class)
	public void noStepAfterFinish() throws Exception
	{
		sim.runToCompletion();
		sim.performNextStep();
	}
	
	@Test
	public void failedStepTerminates() throws Exception
	{
		model.failOnDay = 2;
		try
		{
			sim.runToCompletion();
			fail("Expected failure on day 2");
		}
		catch(InvariantViolationException e)
		{
			assertEquals(2, e.getDay());
			assertEquals("test invariant", e.getInvariant());
			assertEquals("unit", e.getUnit());
		}
		assertEquals(Simulator.Phase.Terminated, sim.getPhase());
		assertEquals(1, sim.getDay());
		assertEquals(Arrays.asList(1), logger.days);
		assertEquals(1, model.finishCalls);
		
		try
		{
			sim.performNextStep();
			fail("Terminated simulator must refuse to continue");
		}
		catch(SimulationException e)
		{
			assertEquals("Already finished.", e.getMessage());
		}
	}
	
	@Test
	public void loggingFailureWrapped() throws Exception
	{
		logger.fail = true;
		try
		{
			sim.performNextStep();
			fail("Expected logging failure");
		}
		catch(SimulationException e)
		{
			assertTrue(e.getCause() instanceof LoggingException);
			assertSame(logger, ((LoggingException)e.getCause()).getLogger());
		}
		assertEquals(Simulator.Phase.Terminated, sim.getPhase());
	}

	@Test
	public void uncheckedFailureTerminates() throws Exception
	{
		model.crashOnDay = 3;
		try
		{
			sim.runToCompletion();
			fail("Expected failure on day 3");
		}
		catch(IllegalStateException e)
		{
			assertEquals("crash on day 3", e.getMessage());
		}
		assertEquals(Simulator.Phase.Terminated, sim.getPhase());
		assertEquals(2, sim.getDay());
		assertEquals(1, model.finishCalls);
		
		try
		{
			sim.performNextStep();
			fail("Terminated simulator must refuse to continue");
		}
		catch(SimulationException e)
		{
			assertEquals("Already finished.", e.getMessage());
		}
	}
	
	@Test
	public void cancelStopsWithoutEnding() throws Exception
	{
		sim.runUntil(2);
		sim.cancel();
		sim.cancel();
		
		assertEquals(Simulator.Phase.Terminated, sim.getPhase());
		assertEquals(1, model.finishCalls);
		assertEquals(0, logger.ends);
		assertEquals(Arrays.asList(1, 2), logger.days);
	}
}
