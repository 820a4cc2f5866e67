package sejirs;

/**
 * What one province's rule evaluation did on one day.
 */
public class DayOutcome
{
	private final String provinceId;
	private final int newExposures;
	private final int deaths;
	private final int vaccinated;
	private final int deniedHospital;
	private final int deniedIcu;
	
	public DayOutcome(String provinceId, int newExposures, int deaths, int vaccinated, int deniedHospital, int deniedIcu)
	{
		this.provinceId = provinceId;
		this.newExposures = newExposures;
		this.deaths = deaths;
		this.vaccinated = vaccinated;
		this.deniedHospital = deniedHospital;
		this.deniedIcu = deniedIcu;
	}
	
	public String getProvinceId() { return provinceId; }
	public int getNewExposures() { return newExposures; }
	public int getDeaths() { return deaths; }
	public int getVaccinated() { return vaccinated; }
	public int getDeniedHospital() { return deniedHospital; }
	public int getDeniedIcu() { return deniedIcu; }
}
