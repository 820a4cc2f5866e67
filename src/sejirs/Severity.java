package sejirs;

/**
 * Bed class required by a hospitalized compartment.
 */
public enum Severity
{
	MODERATE(Compartment.J3),
	SEVERE(Compartment.J4);
	
	private final Compartment compartment;
	
	Severity(Compartment compartment)
	{
		this.compartment = compartment;
	}
	
	public Compartment compartment()
	{
		return compartment;
	}
	
	/**
	 * @return the severity whose beds the compartment occupies, or null
	 * if the compartment needs no bed
	 */
	public static Severity of(Compartment compartment)
	{
		switch(compartment)
		{
			case J3:
				return MODERATE;
			case J4:
				return SEVERE;
			default:
				return null;
		}
	}
}
