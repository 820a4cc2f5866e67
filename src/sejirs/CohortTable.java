package sejirs;

/**
 * Aggregated population counts indexed by compartment, behavior class and
 * days spent in the compartment.
 * 
 * Days in compartment are tracked up to {@link #MAX_TRACKED_DAYS}; anyone
 * who has been in a compartment longer is counted in that last bucket.
 * Counts are not checked for sign here; {@link InvariantChecker} does that
 * once per day.
 */
public class CohortTable
{
	public static final int MAX_TRACKED_DAYS = 60;
	
	private static final int COMPARTMENTS = Compartment.LIVING.length;
	private static final int CLASSES = BehaviorClass.values().length;
	private static final int BUCKETS = MAX_TRACKED_DAYS + 1;
	
	private final int[] counts;
	
	public CohortTable()
	{
		counts = new int[COMPARTMENTS * CLASSES * BUCKETS];
	}
	
	private CohortTable(int[] counts)
	{
		this.counts = counts;
	}
	
	public CohortTable copy()
	{
		return new CohortTable(counts.clone());
	}
	
	public int get(Compartment compartment, BehaviorClass behavior, int days)
	{
		return counts[index(compartment, behavior, days)];
	}
	
	public void add(Compartment compartment, BehaviorClass behavior, int days, int amount)
	{
		counts[index(compartment, behavior, days)] += amount;
	}
	
	public int count(Compartment compartment, BehaviorClass behavior)
	{
		int start = index(compartment, behavior, 0);
		int sum = 0;
		for(int i = start; i < start + BUCKETS; i++)
			sum += counts[i];
		return sum;
	}
	
	public int count(Compartment compartment)
	{
		int sum = 0;
		for(BehaviorClass behavior : BehaviorClass.values())
			sum += count(compartment, behavior);
		return sum;
	}
	
	public int living()
	{
		int sum = 0;
		for(int count : counts)
			sum += count;
		return sum;
	}
	
	public int active()
	{
		int sum = 0;
		for(Compartment compartment : Compartment.LIVING)
		{
			if(compartment.isActive())
				sum += count(compartment);
		}
		return sum;
	}
	
	/**
	 * Smallest cell count; negative means the table is corrupt.
	 */
	public int minimum()
	{
		int min = Integer.MAX_VALUE;
		for(int count : counts)
			min = Math.min(min, count);
		return min;
	}
	
	/**
	 * Bucket for someone who has spent one more day than {@code days}.
	 */
	public static int older(int days)
	{
		return Math.min(days + 1, MAX_TRACKED_DAYS);
	}
	
	private static int index(Compartment compartment, BehaviorClass behavior, int days)
	{
		if(!compartment.isLiving())
			throw new IllegalArgumentException("No cohort cells for " + compartment);
		if(days < 0 || days > MAX_TRACKED_DAYS)
			throw new IllegalArgumentException("Days in compartment out of range: " + days);
		
		return (compartment.ordinal() * CLASSES + behavior.ordinal()) * BUCKETS + days;
	}
}
