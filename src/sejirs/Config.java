package sejirs;

import java.io.Reader;
import java.util.*;

import com.google.gson.*;

/**
 * Run configuration as read from JSON. Every field has a default, so a
 * configuration file only needs the values it changes (plus the provinces).
 * 
 * Probabilities and rates are per day. The configuration is checked and
 * frozen by {@link Parameters#fromConfig(Config)} before a run starts.
 */
public class Config
{
	public Integer randomSeed = null;
	public Integer runNum = null;
	
	// Hard limit on the number of simulated days
	public int maxDays = 120;
	
	// Threads evaluating provinces in parallel; results do not depend on it
	public int threads = 1;
	
	// Progress output interval, in days
	public int logInterval = 1;
	
	public List<ProvinceConfig> provinces = new ArrayList<ProvinceConfig>();
	public List<EdgeConfig> mobility = new ArrayList<EdgeConfig>();
	public List<Compartment> movableCompartments = new ArrayList<Compartment>(Arrays.asList(Compartment.S, Compartment.I));
	
	// Probability that one contact with an infectious individual exposes a susceptible one
	public double transmissionProbability = 0.05;
	
	// Contacts per individual per day
	public double contactRate = 10.0;
	
	// E->I once minIncubationDays have passed
	public double incubationRate = 0.5;
	public int minIncubationDays = 2;
	
	// I->J3 / I->J4; severeFraction of symptomatic cases need intensive care
	public double symptomRate = 0.05;
	public double severeFraction = 0.2;
	
	// I->R
	public double recoveryRate = 0.2;
	
	// J3->R once minHospitalDays have passed, J3->J4, J3->deceased
	public double hospitalDischargeRate = 0.25;
	public int minHospitalDays = 3;
	public double worseningRate = 0.02;
	public double hospitalDeathRate = 0.005;
	
	// J4->R once minIcuDays have passed, J4->deceased
	public double icuDischargeRate = 0.15;
	public int minIcuDays = 5;
	public double icuDeathRate = 0.02;
	
	// R->S; with waningImmunity == false recovery is permanent
	public boolean waningImmunity = false;
	public double waningRate = 1.0 / 180;
	
	// Fraction by which prudence reduces exposure
	public double prudenceDiscount = 0.9;
	
	// Fractions by which vaccination reduces exposure and severity
	public double vaccinationDiscount = 0.8;
	public double vaccinationSeverityDiscount = 0.8;
	
	public double fractionPrudent = 0.0;
	public double fractionVaccinated = 0.0;
	
	public AdmissionPolicy admissionPolicy = AdmissionPolicy.BLOCK;
	
	// Probability that a refused admission dies under AdmissionPolicy.DEGRADE
	public double degradedFatality = 0.5;
	
	// If behaviorFeedback == true, contacts drop as local prevalence grows:
	// contacts / (1 + cautionSensitivity * active / population)
	public boolean behaviorFeedback = false;
	public double cautionSensitivity = 10.0;
	
	// Optional intervention windows; null disables them
	public WindowConfig quarantine = null;
	public WindowConfig movementRestriction = null;
	public CampaignConfig vaccinationCampaign = null;
	
	public static class ProvinceConfig
	{
		public String id;
		public int population;
		public int hospitalCapacity;
		public int icuCapacity;
		public int initialExposed;
		public int initialInfectious;
		
		public ProvinceConfig()
		{
		}
		
		public ProvinceConfig(String id, int population, int hospitalCapacity, int icuCapacity, int initialInfectious)
		{
			this.id = id;
			this.population = population;
			this.hospitalCapacity = hospitalCapacity;
			this.icuCapacity = icuCapacity;
			this.initialInfectious = initialInfectious;
		}
	}
	
	public static class EdgeConfig
	{
		public String from;
		public String to;
		public double weight;
		
		public EdgeConfig()
		{
		}
		
		public EdgeConfig(String from, String to, double weight)
		{
			this.from = from;
			this.to = to;
			this.weight = weight;
		}
	}
	
	/**
	 * Days [startDay, startDay + durationDays) during which contacts (for a
	 * quarantine) or movement (for a movement restriction) are multiplied by factor.
	 */
	public static class WindowConfig
	{
		public int startDay;
		public int durationDays;
		public double factor = 1.0;
		
		public WindowConfig()
		{
		}
		
		public WindowConfig(int startDay, int durationDays, double factor)
		{
			this.startDay = startDay;
			this.durationDays = durationDays;
			this.factor = factor;
		}
	}
	
	/**
	 * From startDay on, unvaccinated susceptibles get vaccinated with daily
	 * probability dailyRate scaled by a willingness that grows with prevalence
	 * relative to referencePrevalence.
	 */
	public static class CampaignConfig
	{
		public int startDay = 1;
		public double dailyRate;
		public double referencePrevalence = 0.01;
		
		public CampaignConfig()
		{
		}
		
		public CampaignConfig(int startDay, double dailyRate, double referencePrevalence)
		{
			this.startDay = startDay;
			this.dailyRate = dailyRate;
			this.referencePrevalence = referencePrevalence;
		}
	}
	
	public Config addProvince(ProvinceConfig province)
	{
		provinces.add(province);
		return this;
	}
	
	public Config addEdge(String from, String to, double weight)
	{
		mobility.add(new EdgeConfig(from, to, weight));
		return this;
	}
	
	public static Config load(Reader reader) throws JsonParseException
	{
		Config config = new Gson().fromJson(reader, Config.class);
		if(config == null)
			throw new JsonParseException("Empty configuration.");
		return config;
	}
	
	public String toJson()
	{
		return new GsonBuilder().setPrettyPrinting().serializeNulls().create().toJson(this);
	}
}
