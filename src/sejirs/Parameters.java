package sejirs;

import java.util.*;

/**
 * Validated, immutable parameter bundle for one run.
 * 
 * Built only through {@link #fromConfig(Config)}, which rejects the whole
 * configuration with a {@link ConfigurationException} if anything is out of
 * range; a simulation never starts from invalid parameters.
 */
public final class Parameters
{
	private final long randomSeed;
	private final int maxDays;
	private final int threads;
	
	private final List<ProvinceParameters> provinces;
	private final List<Edge> edges;
	private final Set<Compartment> movableCompartments;
	
	private final double transmissionProbability;
	private final double contactRate;
	private final double incubationRate;
	private final int minIncubationDays;
	private final double symptomRate;
	private final double severeFraction;
	private final double recoveryRate;
	private final double hospitalDischargeRate;
	private final int minHospitalDays;
	private final double worseningRate;
	private final double hospitalDeathRate;
	private final double icuDischargeRate;
	private final int minIcuDays;
	private final double icuDeathRate;
	private final boolean waningImmunity;
	private final double waningRate;
	
	private final double prudenceDiscount;
	private final double vaccinationDiscount;
	private final double vaccinationSeverityDiscount;
	private final double fractionPrudent;
	private final double fractionVaccinated;
	
	private final AdmissionPolicy admissionPolicy;
	private final double degradedFatality;
	
	private final boolean behaviorFeedback;
	private final double cautionSensitivity;
	private final Window quarantine;
	private final Window movementRestriction;
	private final Campaign vaccinationCampaign;
	
	private Parameters(Config config, long randomSeed)
	{
		this.randomSeed = randomSeed;
		maxDays = config.maxDays;
		threads = config.threads;
		
		List<ProvinceParameters> provinceList = new ArrayList<ProvinceParameters>();
		Map<String, Integer> indices = new HashMap<String, Integer>();
		for(Config.ProvinceConfig p : config.provinces)
		{
			indices.put(p.id, provinceList.size());
			provinceList.add(new ProvinceParameters(p.id, provinceList.size(), p.population,
				p.hospitalCapacity, p.icuCapacity, p.initialExposed, p.initialInfectious));
		}
		provinces = Collections.unmodifiableList(provinceList);
		
		List<Edge> edgeList = new ArrayList<Edge>();
		if(config.mobility != null)
		{
			for(Config.EdgeConfig e : config.mobility)
				edgeList.add(new Edge(indices.get(e.from), indices.get(e.to), e.weight));
		}
		edges = Collections.unmodifiableList(edgeList);
		
		EnumSet<Compartment> movable = EnumSet.noneOf(Compartment.class);
		movable.addAll(config.movableCompartments);
		movableCompartments = Collections.unmodifiableSet(movable);
		
		transmissionProbability = config.transmissionProbability;
		contactRate = config.contactRate;
		incubationRate = config.incubationRate;
		minIncubationDays = config.minIncubationDays;
		symptomRate = config.symptomRate;
		severeFraction = config.severeFraction;
		recoveryRate = config.recoveryRate;
		hospitalDischargeRate = config.hospitalDischargeRate;
		minHospitalDays = config.minHospitalDays;
		worseningRate = config.worseningRate;
		hospitalDeathRate = config.hospitalDeathRate;
		icuDischargeRate = config.icuDischargeRate;
		minIcuDays = config.minIcuDays;
		icuDeathRate = config.icuDeathRate;
		waningImmunity = config.waningImmunity;
		waningRate = config.waningRate;
		
		prudenceDiscount = config.prudenceDiscount;
		vaccinationDiscount = config.vaccinationDiscount;
		vaccinationSeverityDiscount = config.vaccinationSeverityDiscount;
		fractionPrudent = config.fractionPrudent;
		fractionVaccinated = config.fractionVaccinated;
		
		admissionPolicy = config.admissionPolicy;
		degradedFatality = config.degradedFatality;
		
		behaviorFeedback = config.behaviorFeedback;
		cautionSensitivity = config.cautionSensitivity;
		quarantine = Window.of(config.quarantine);
		movementRestriction = Window.of(config.movementRestriction);
		vaccinationCampaign = config.vaccinationCampaign == null ? null
			: new Campaign(config.vaccinationCampaign.startDay, config.vaccinationCampaign.dailyRate,
				config.vaccinationCampaign.referencePrevalence);
	}
	
	/**
	 * Checks a configuration and freezes it.
	 * 
	 * @throws ConfigurationException listing every problem found
	 */
	public static Parameters fromConfig(Config config)
	{
		List<String> problems = new ArrayList<String>();
		
		if(config.maxDays <= 0)
			problems.add("maxDays must be positive: " + config.maxDays);
		if(config.threads < 1)
			problems.add("threads must be at least 1: " + config.threads);
		if(config.logInterval < 1)
			problems.add("logInterval must be at least 1: " + config.logInterval);
		
		Set<String> ids = new HashSet<String>();
		if(config.provinces == null || config.provinces.isEmpty())
		{
			problems.add("at least one province is required");
		}
		else
		{
			for(Config.ProvinceConfig p : config.provinces)
				checkProvince(p, ids, problems);
		}
		
		checkMobility(config, ids, problems);
		
		if(config.movableCompartments == null)
		{
			problems.add("movableCompartments must be given");
		}
		else
		{
			for(Compartment c : config.movableCompartments)
			{
				if(c == null)
					problems.add("movableCompartments contains an unknown compartment");
				else if(c == Compartment.J3 || c == Compartment.J4 || c == Compartment.DECEASED)
					problems.add("compartment " + c + " cannot be movable");
			}
		}
		
		checkProbability("transmissionProbability", config.transmissionProbability, problems);
		checkNonNegative("contactRate", config.contactRate, problems);
		checkProbability("incubationRate", config.incubationRate, problems);
		checkNonNegative("minIncubationDays", config.minIncubationDays, problems);
		checkProbability("symptomRate", config.symptomRate, problems);
		checkProbability("severeFraction", config.severeFraction, problems);
		checkProbability("recoveryRate", config.recoveryRate, problems);
		checkProbability("hospitalDischargeRate", config.hospitalDischargeRate, problems);
		checkNonNegative("minHospitalDays", config.minHospitalDays, problems);
		checkProbability("worseningRate", config.worseningRate, problems);
		checkProbability("hospitalDeathRate", config.hospitalDeathRate, problems);
		checkProbability("icuDischargeRate", config.icuDischargeRate, problems);
		checkNonNegative("minIcuDays", config.minIcuDays, problems);
		checkProbability("icuDeathRate", config.icuDeathRate, problems);
		checkProbability("waningRate", config.waningRate, problems);
		checkProbability("prudenceDiscount", config.prudenceDiscount, problems);
		checkProbability("vaccinationDiscount", config.vaccinationDiscount, problems);
		checkProbability("vaccinationSeverityDiscount", config.vaccinationSeverityDiscount, problems);
		checkProbability("fractionPrudent", config.fractionPrudent, problems);
		checkProbability("fractionVaccinated", config.fractionVaccinated, problems);
		checkProbability("degradedFatality", config.degradedFatality, problems);
		checkNonNegative("cautionSensitivity", config.cautionSensitivity, problems);
		
		if(config.admissionPolicy == null)
			problems.add("admissionPolicy must be BLOCK or DEGRADE");
		
		checkWindow("quarantine", config.quarantine, problems);
		checkWindow("movementRestriction", config.movementRestriction, problems);
		
		if(config.vaccinationCampaign != null)
		{
			Config.CampaignConfig campaign = config.vaccinationCampaign;
			if(campaign.startDay < 1)
				problems.add("vaccinationCampaign.startDay must be at least 1: " + campaign.startDay);
			checkProbability("vaccinationCampaign.dailyRate", campaign.dailyRate, problems);
			if(!(campaign.referencePrevalence > 0))
				problems.add("vaccinationCampaign.referencePrevalence must be positive: " + campaign.referencePrevalence);
		}
		
		if(!problems.isEmpty())
			throw new ConfigurationException(problems);
		
		long seed = config.randomSeed == null ? System.currentTimeMillis() : config.randomSeed;
		return new Parameters(config, seed);
	}
	
	private static void checkProvince(Config.ProvinceConfig p, Set<String> ids, List<String> problems)
	{
		if(p == null)
		{
			problems.add("province entry is empty");
			return;
		}
		
		if(p.id == null || p.id.trim().isEmpty())
			problems.add("province id must not be blank");
		else if(!ids.add(p.id))
			problems.add("duplicate province id " + p.id);
		
		String name = "province " + p.id;
		if(p.population < 0)
			problems.add(name + ": population must be non-negative: " + p.population);
		if(p.hospitalCapacity < 0)
			problems.add(name + ": hospitalCapacity must be non-negative: " + p.hospitalCapacity);
		if(p.icuCapacity < 0)
			problems.add(name + ": icuCapacity must be non-negative: " + p.icuCapacity);
		if(p.initialExposed < 0 || p.initialInfectious < 0)
			problems.add(name + ": initial exposed and infectious counts must be non-negative");
		else if((long)p.initialExposed + p.initialInfectious > p.population)
			problems.add(name + ": initial exposed and infectious exceed the population");
	}
	
	private static void checkMobility(Config config, Set<String> ids, List<String> problems)
	{
		if(config.mobility == null) return;
		
		Map<String, Double> outgoing = new HashMap<String, Double>();
		for(Config.EdgeConfig e : config.mobility)
		{
			if(e == null)
			{
				problems.add("mobility entry is empty");
				continue;
			}
			
			String name = "mobility edge " + e.from + "->" + e.to;
			boolean known = true;
			if(!ids.contains(e.from))
			{
				problems.add(name + ": unknown province " + e.from);
				known = false;
			}
			if(!ids.contains(e.to))
			{
				problems.add(name + ": unknown province " + e.to);
				known = false;
			}
			if(known && e.from.equals(e.to))
				problems.add(name + ": self loops are not allowed");
			if(!(e.weight >= 0 && e.weight <= 1))
				problems.add(name + ": weight must be in [0,1]: " + e.weight);
			else if(known)
			{
				Double sum = outgoing.get(e.from);
				outgoing.put(e.from, sum == null ? e.weight : sum + e.weight);
			}
		}
		
		for(Map.Entry<String, Double> entry : outgoing.entrySet())
		{
			if(entry.getValue() > 1)
				problems.add("outgoing mobility of province " + entry.getKey() + " exceeds 1: " + entry.getValue());
		}
	}
	
	private static void checkWindow(String name, Config.WindowConfig window, List<String> problems)
	{
		if(window == null) return;
		
		if(window.startDay < 1)
			problems.add(name + ".startDay must be at least 1: " + window.startDay);
		if(window.durationDays < 0)
			problems.add(name + ".durationDays must be non-negative: " + window.durationDays);
		checkProbability(name + ".factor", window.factor, problems);
	}
	
	private static void checkProbability(String name, double value, List<String> problems)
	{
		if(!(value >= 0 && value <= 1))
			problems.add(name + " must be in [0,1]: " + value);
	}
	
	private static void checkNonNegative(String name, double value, List<String> problems)
	{
		if(!(value >= 0) || Double.isInfinite(value))
			problems.add(name + " must be a non-negative number: " + value);
	}
	
	public static final class ProvinceParameters
	{
		private final String id;
		private final int index;
		private final int population;
		private final int hospitalCapacity;
		private final int icuCapacity;
		private final int initialExposed;
		private final int initialInfectious;
		
		ProvinceParameters(String id, int index, int population, int hospitalCapacity, int icuCapacity,
			int initialExposed, int initialInfectious)
		{
			this.id = id;
			this.index = index;
			this.population = population;
			this.hospitalCapacity = hospitalCapacity;
			this.icuCapacity = icuCapacity;
			this.initialExposed = initialExposed;
			this.initialInfectious = initialInfectious;
		}
		
		public String getId() { return id; }
		public int getIndex() { return index; }
		public int getPopulation() { return population; }
		public int getHospitalCapacity() { return hospitalCapacity; }
		public int getIcuCapacity() { return icuCapacity; }
		public int getInitialExposed() { return initialExposed; }
		public int getInitialInfectious() { return initialInfectious; }
	}
	
	public static final class Edge
	{
		private final int from;
		private final int to;
		private final double weight;
		
		Edge(int from, int to, double weight)
		{
			this.from = from;
			this.to = to;
			this.weight = weight;
		}
		
		public int getFrom() { return from; }
		public int getTo() { return to; }
		public double getWeight() { return weight; }
	}
	
	public static final class Window
	{
		private final int startDay;
		private final int durationDays;
		private final double factor;
		
		Window(int startDay, int durationDays, double factor)
		{
			this.startDay = startDay;
			this.durationDays = durationDays;
			this.factor = factor;
		}
		
		static Window of(Config.WindowConfig config)
		{
			return config == null ? null : new Window(config.startDay, config.durationDays, config.factor);
		}
		
		public boolean contains(int day)
		{
			return day >= startDay && day < (long)startDay + durationDays;
		}
		
		/**
		 * @return the window's factor on days inside it, 1 otherwise
		 */
		public double factorOn(int day)
		{
			return contains(day) ? factor : 1.0;
		}
		
		public int getStartDay() { return startDay; }
		public int getDurationDays() { return durationDays; }
		public double getFactor() { return factor; }
	}
	
	public static final class Campaign
	{
		private final int startDay;
		private final double dailyRate;
		private final double referencePrevalence;
		
		Campaign(int startDay, double dailyRate, double referencePrevalence)
		{
			this.startDay = startDay;
			this.dailyRate = dailyRate;
			this.referencePrevalence = referencePrevalence;
		}
		
		public boolean isRunning(int day)
		{
			return dailyRate > 0 && day >= startDay;
		}
		
		public int getStartDay() { return startDay; }
		public double getDailyRate() { return dailyRate; }
		public double getReferencePrevalence() { return referencePrevalence; }
	}
	
	public long getRandomSeed() { return randomSeed; }
	public int getMaxDays() { return maxDays; }
	public int getThreads() { return threads; }
	public List<ProvinceParameters> getProvinces() { return provinces; }
	public List<Edge> getEdges() { return edges; }
	public Set<Compartment> getMovableCompartments() { return movableCompartments; }
	
	public double getTransmissionProbability() { return transmissionProbability; }
	public double getContactRate() { return contactRate; }
	public double getIncubationRate() { return incubationRate; }
	public int getMinIncubationDays() { return minIncubationDays; }
	public double getSymptomRate() { return symptomRate; }
	public double getSevereFraction() { return severeFraction; }
	public double getRecoveryRate() { return recoveryRate; }
	public double getHospitalDischargeRate() { return hospitalDischargeRate; }
	public int getMinHospitalDays() { return minHospitalDays; }
	public double getWorseningRate() { return worseningRate; }
	public double getHospitalDeathRate() { return hospitalDeathRate; }
	public double getIcuDischargeRate() { return icuDischargeRate; }
	public int getMinIcuDays() { return minIcuDays; }
	public double getIcuDeathRate() { return icuDeathRate; }
	public boolean isWaningImmunity() { return waningImmunity; }
	public double getWaningRate() { return waningRate; }
	
	public double getPrudenceDiscount() { return prudenceDiscount; }
	public double getVaccinationDiscount() { return vaccinationDiscount; }
	public double getVaccinationSeverityDiscount() { return vaccinationSeverityDiscount; }
	public double getFractionPrudent() { return fractionPrudent; }
	public double getFractionVaccinated() { return fractionVaccinated; }
	
	public AdmissionPolicy getAdmissionPolicy() { return admissionPolicy; }
	public double getDegradedFatality() { return degradedFatality; }
	
	public boolean isBehaviorFeedback() { return behaviorFeedback; }
	public double getCautionSensitivity() { return cautionSensitivity; }
	
	/** @return the quarantine window, or null if none is configured */
	public Window getQuarantine() { return quarantine; }
	
	/** @return the movement restriction window, or null if none is configured */
	public Window getMovementRestriction() { return movementRestriction; }
	
	/** @return the vaccination campaign, or null if none is configured */
	public Campaign getVaccinationCampaign() { return vaccinationCampaign; }
}
