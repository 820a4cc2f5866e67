package sejirs;

/**
 * Behavioral response of the population to the epidemic.
 */
public class BehaviorModel
{
	private BehaviorModel()
	{
	}
	
	/**
	 * Contact multiplier as people grow cautious: 1 with no active
	 * infections, falling towards 0 as the active share grows.
	 */
	public static double cautionFactor(int active, int population, double sensitivity)
	{
		if(population == 0) return 0.0;
		return 1.0 / (1.0 + sensitivity * active / population);
	}
	
	/**
	 * Willingness to get vaccinated, in [0,1): x^2 / (1 + x^2) with x the
	 * prevalence relative to the reference prevalence.
	 */
	public static double vaccinationWillingness(double prevalence, double referencePrevalence)
	{
		double x = prevalence / referencePrevalence;
		return x * x / (1 + x * x);
	}
	
	/**
	 * Daily probability that a susceptible individual gets exposed:
	 * 1 - (1 - q)^c, where q is the per-contact transmission probability after
	 * discounts and c the expected number of contacts with infectious people.
	 */
	public static double exposureProbability(double transmission, double discount, double infectiousContacts)
	{
		double q = Math.max(0.0, Math.min(1.0, transmission * discount));
		if(infectiousContacts <= 0 || q == 0) return 0.0;
		return 1.0 - Math.pow(1.0 - q, infectiousContacts);
	}
}
