package sejirs;

/**
 * What happens to an individual who needs a hospital or ICU bed when none is free.
 */
public enum AdmissionPolicy
{
	/** Stays in the compartment it was leaving. */
	BLOCK,
	
	/** Dies with the configured degraded fatality; survivors stay where they were. */
	DEGRADE
}
