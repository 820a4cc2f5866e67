package sejirs;

/**
 * Fixed behavioral attributes of a cohort: prudence reduces exposure,
 * vaccination reduces both infection and severity.
 */
public enum BehaviorClass
{
	PLAIN(false, false),
	PRUDENT(true, false),
	VACCINATED(false, true),
	PRUDENT_VACCINATED(true, true);
	
	private final boolean prudent;
	private final boolean vaccinated;
	
	BehaviorClass(boolean prudent, boolean vaccinated)
	{
		this.prudent = prudent;
		this.vaccinated = vaccinated;
	}
	
	public boolean isPrudent()
	{
		return prudent;
	}
	
	public boolean isVaccinated()
	{
		return vaccinated;
	}
	
	public BehaviorClass vaccinatedCounterpart()
	{
		return of(prudent, true);
	}
	
	/**
	 * Expected share of a population in this class when prudence and
	 * vaccination are assigned independently.
	 */
	public double share(double fractionPrudent, double fractionVaccinated)
	{
		return (prudent ? fractionPrudent : 1 - fractionPrudent)
			* (vaccinated ? fractionVaccinated : 1 - fractionVaccinated);
	}
	
	public static BehaviorClass of(boolean prudent, boolean vaccinated)
	{
		if(prudent)
			return vaccinated ? PRUDENT_VACCINATED : PRUDENT;
		else
			return vaccinated ? VACCINATED : PLAIN;
	}
}
