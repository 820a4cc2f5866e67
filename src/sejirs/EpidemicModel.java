package sejirs;

import java.util.*;
import java.util.concurrent.*;

import jstoch.model.*;

/**
 * One day of the provincial epidemic: the transition rules for every
 * province, then movement between provinces, then the consistency checks.
 * 
 * With more than one thread, provinces are evaluated in parallel. Each task
 * only touches its own province and draws from its own random stream, and
 * mobility starts only once every task has completed, so the result does not
 * depend on the number of threads.
 */
public class EpidemicModel implements DiscreteTimeModel
{
	/** Name prefix of the threads evaluating provinces in parallel. */
	public static final String RULE_THREAD_PREFIX = "sejirs-rules-";
	
	private static final long IDLE_SECONDS = 1;
	
	private final Parameters params;
	
	private SimulationContext context;
	private TransitionRules rules;
	private InvariantChecker checker;
	private ExecutorService executor;
	
	private DailySummary lastSummary;
	
	public EpidemicModel(Parameters params)
	{
		this.params = params;
	}
	
	public void initialize() throws SimulationException
	{
		context = new SimulationContext(params);
		rules = new TransitionRules(params);
		checker = new InvariantChecker(context.getInitialPopulation());
		
		if(params.getThreads() > 1)
			executor = newRulePool(Math.min(params.getThreads(), context.getProvinces().size()));
		
		checker.check(context.getProvinces(), 0);
	}
	
	public void step(int day) throws SimulationException
	{
		List<DayOutcome> outcomes;
		if(executor == null)
			outcomes = applyRulesSequentially(day);
		else
			outcomes = applyRulesInParallel(day);
		
		int moved = 0;
		if(!params.getEdges().isEmpty())
		{
			Parameters.Window restriction = params.getMovementRestriction();
			double factor = restriction == null ? 1.0 : restriction.factorOn(day);
			moved = context.getNetwork().apply(context, day, factor);
		}
		
		checker.check(context.getProvinces(), day);
		lastSummary = DailySummary.of(day, outcomes, context.getProvinces(), moved);
	}
	
	/**
	 * Daemon workers that exit after a second without work, so a run that is
	 * dropped before {@link #finish()} holds no threads.
	 */
	private static ExecutorService newRulePool(int threads)
	{
		ThreadPoolExecutor pool = new ThreadPoolExecutor(threads, threads,
			IDLE_SECONDS, TimeUnit.SECONDS, new LinkedBlockingQueue<Runnable>(),
			new ThreadFactory()
			{
				private int count = 0;
				
				public synchronized Thread newThread(Runnable r)
				{
					Thread thread = new Thread(r, RULE_THREAD_PREFIX + (++count));
					thread.setDaemon(true);
					return thread;
				}
			});
		pool.allowCoreThreadTimeOut(true);
		return pool;
	}
	
	private List<DayOutcome> applyRulesSequentially(int day) throws SimulationException
	{
		List<DayOutcome> outcomes = new ArrayList<DayOutcome>();
		for(Province province : context.getProvinces())
			outcomes.add(rules.apply(context, province, day));
		return outcomes;
	}
	
	private List<DayOutcome> applyRulesInParallel(final int day) throws SimulationException
	{
		List<Callable<DayOutcome>> tasks = new ArrayList<Callable<DayOutcome>>();
		for(final Province province : context.getProvinces())
		{
			tasks.add(new Callable<DayOutcome>()
			{
				public DayOutcome call() throws Exception
				{
					return rules.apply(context, province, day);
				}
			});
		}
		
		List<DayOutcome> outcomes = new ArrayList<DayOutcome>();
		try
		{
			for(Future<DayOutcome> future : executor.invokeAll(tasks))
				outcomes.add(future.get());
		}
		catch(InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new SimulationException("Interrupted while applying transition rules", day, e);
		}
		catch(ExecutionException e)
		{
			Throwable cause = e.getCause();
			if(cause instanceof SimulationException)
				throw (SimulationException)cause;
			if(cause instanceof RuntimeException)
				throw (RuntimeException)cause;
			throw new SimulationException("Transition rules failed", day, cause);
		}
		return outcomes;
	}
	
	/**
	 * Finished once the last day has been simulated or nobody is infected
	 * anywhere.
	 */
	public boolean isFinished(int day)
	{
		return day >= params.getMaxDays() || context.getTotalActive() == 0;
	}
	
	public void finish() throws SimulationException
	{
		if(executor != null)
		{
			executor.shutdownNow();
			executor = null;
		}
	}
	
	/**
	 * Current state of every province, in configuration order.
	 */
	public List<OutputRow> snapshot(int day)
	{
		List<OutputRow> rows = new ArrayList<OutputRow>();
		for(Province province : context.getProvinces())
			rows.add(OutputRow.of(day, province));
		return rows;
	}
	
	public Parameters getParameters()
	{
		return params;
	}
	
	public SimulationContext getContext()
	{
		return context;
	}
	
	/**
	 * @return the summary of the most recent day, or null before day 1
	 */
	public DailySummary getLastSummary()
	{
		return lastSummary;
	}
}
