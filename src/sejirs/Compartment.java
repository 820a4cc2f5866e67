package sejirs;

/**
 * SEJIRS disease states, plus the terminal DECEASED outcome.
 * 
 * The declaration order is significant: it breaks ties when transitions
 * out of one compartment are ordered for evaluation.
 */
public enum Compartment
{
	S("susceptible", false),
	E("exposed", true),
	J3("hospitalized", true),
	J4("intensive care", true),
	I("infectious", true),
	R("recovered", false),
	DECEASED("deceased", false);
	
	/**
	 * Compartments an individual can occupy, in declaration order.
	 */
	public static final Compartment[] LIVING = { S, E, J3, J4, I, R };
	
	private final String description;
	private final boolean active;
	
	Compartment(String description, boolean active)
	{
		this.description = description;
		this.active = active;
	}
	
	public String description()
	{
		return description;
	}
	
	/**
	 * True for the compartments counted as an ongoing infection.
	 */
	public boolean isActive()
	{
		return active;
	}
	
	public boolean isLiving()
	{
		return this != DECEASED;
	}
}
