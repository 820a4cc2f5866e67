package sejirs;

import java.util.*;

import cern.jet.random.engine.RandomEngine;

import jstoch.model.InvariantViolationException;
import jstoch.random.BinomialSampler;

/**
 * The SEJIRS progression rules, applied to one province for one day.
 * 
 * All probabilities are computed from the province's table as it was at the
 * start of the day, and the results are written to a fresh table, so no
 * transition sees another transition of the same day. Outgoing transitions
 * of a compartment are mutually exclusive trials evaluated in priority
 * order: destinations holding fewer individuals first, ties in
 * {@link Compartment} declaration order.
 * 
 * Bed bookkeeping happens in a fixed order: beds vacated by discharges and
 * deaths are released first, then ICU admissions are granted (transfers from
 * J3 before new cases from I), then hospital admissions. Refused admissions
 * are resolved by the configured {@link AdmissionPolicy}.
 */
public class TransitionRules
{
	/** Random stream phase used for rule evaluation. */
	public static final int STREAM_PHASE = 1;
	
	private static final EnumMap<Compartment, EnumSet<Compartment>> TRANSITIONS = new EnumMap<Compartment, EnumSet<Compartment>>(Compartment.class);
	static
	{
		TRANSITIONS.put(Compartment.S, EnumSet.of(Compartment.E));
		TRANSITIONS.put(Compartment.E, EnumSet.of(Compartment.I));
		TRANSITIONS.put(Compartment.I, EnumSet.of(Compartment.J3, Compartment.J4, Compartment.R));
		TRANSITIONS.put(Compartment.J3, EnumSet.of(Compartment.R, Compartment.J4, Compartment.DECEASED));
		TRANSITIONS.put(Compartment.J4, EnumSet.of(Compartment.R, Compartment.DECEASED));
		TRANSITIONS.put(Compartment.R, EnumSet.of(Compartment.S));
	}
	
	private final Parameters params;
	
	public TransitionRules(Parameters params)
	{
		this.params = params;
	}
	
	public DayOutcome apply(SimulationContext context, Province province, int day) throws InvariantViolationException
	{
		RandomEngine rng = context.getStreams().stream(day, province.getIndex(), STREAM_PHASE);
		try
		{
			return apply(province, day, new BinomialSampler(rng));
		}
		catch(InvariantViolationException e)
		{
			throw e.atDay(day);
		}
	}
	
	DayOutcome apply(Province province, int day, BinomialSampler binomial) throws InvariantViolationException
	{
		CohortTable frozen = province.getCohorts();
		CohortTable next = new CohortTable();
		ResourcePool pool = province.getResources();
		
		double infectiousContacts = infectiousContacts(frozen, day);
		double vaccinationProbability = vaccinationProbability(frozen, day);
		List<Compartment> priority = priorityOrder(province);
		
		List<Admission> admissions = new ArrayList<Admission>();
		int newExposures = 0;
		int deaths = 0;
		int vaccinated = 0;
		
		for(Compartment source : Compartment.LIVING)
		{
			Compartment[] targets = targets(source, priority);
			Severity sourceBeds = Severity.of(source);
			
			for(BehaviorClass behavior : BehaviorClass.values())
			{
				for(int days = 0; days <= CohortTable.MAX_TRACKED_DAYS; days++)
				{
					int n = frozen.get(source, behavior, days);
					if(n == 0) continue;
					
					double[] probabilities = new double[targets.length];
					for(int t = 0; t < targets.length; t++)
						probabilities[t] = clamp(probability(source, targets[t], behavior, days, infectiousContacts));
					
					int[] moved = binomial.nextSequential(n, probabilities);
					int stayers = n;
					for(int t = 0; t < targets.length; t++)
					{
						int k = moved[t];
						if(k == 0) continue;
						stayers -= k;
						
						Compartment target = targets[t];
						Severity needed = Severity.of(target);
						if(needed != null)
						{
							admissions.add(new Admission(source, behavior, days, needed, k));
							continue;
						}
						
						if(sourceBeds != null)
							pool.release(sourceBeds, k);
						
						if(target == Compartment.DECEASED)
							deaths += k;
						else
							next.add(target, behavior, 0, k);
						
						if(target == Compartment.E)
							newExposures += k;
					}
					
					if(source == Compartment.S && !behavior.isVaccinated() && vaccinationProbability > 0)
					{
						int v = binomial.nextInt(stayers, vaccinationProbability);
						next.add(Compartment.S, behavior.vaccinatedCounterpart(), CohortTable.older(days), v);
						stayers -= v;
						vaccinated += v;
					}
					
					next.add(source, behavior, CohortTable.older(days), stayers);
				}
			}
		}
		
		int[] denied = new int[Severity.values().length];
		for(Severity severity : new Severity[] { Severity.SEVERE, Severity.MODERATE })
		{
			for(Admission admission : admissions)
			{
				if(admission.severity != severity) continue;
				
				Severity sourceBeds = Severity.of(admission.source);
				int admitted = pool.admit(severity, admission.count);
				if(admitted > 0)
				{
					if(sourceBeds != null)
						pool.release(sourceBeds, admitted);
					next.add(severity.compartment(), admission.behavior, 0, admitted);
				}
				
				int refused = admission.count - admitted;
				if(refused == 0) continue;
				
				denied[severity.ordinal()] += refused;
				int died = 0;
				if(params.getAdmissionPolicy() == AdmissionPolicy.DEGRADE)
				{
					died = binomial.nextInt(refused, params.getDegradedFatality());
					deaths += died;
					if(sourceBeds != null)
						pool.release(sourceBeds, died);
				}
				next.add(admission.source, admission.behavior, CohortTable.older(admission.days), refused - died);
			}
		}
		
		province.setCohorts(next);
		province.addDeaths(deaths);
		province.addDeniedAdmissions(Severity.MODERATE, denied[Severity.MODERATE.ordinal()]);
		province.addDeniedAdmissions(Severity.SEVERE, denied[Severity.SEVERE.ordinal()]);
		
		return new DayOutcome(province.getId(), newExposures, deaths, vaccinated,
			denied[Severity.MODERATE.ordinal()], denied[Severity.SEVERE.ordinal()]);
	}
	
	/**
	 * Expected number of contacts with infectious individuals that one
	 * susceptible individual has today.
	 */
	double infectiousContacts(CohortTable frozen, int day)
	{
		int population = frozen.living();
		if(population == 0) return 0.0;
		
		double contacts = params.getContactRate();
		if(params.isBehaviorFeedback())
			contacts *= BehaviorModel.cautionFactor(frozen.active(), population, params.getCautionSensitivity());
		if(params.getQuarantine() != null)
			contacts *= params.getQuarantine().factorOn(day);
		
		return contacts * frozen.count(Compartment.I) / population;
	}
	
	private double vaccinationProbability(CohortTable frozen, int day)
	{
		Parameters.Campaign campaign = params.getVaccinationCampaign();
		if(campaign == null || !campaign.isRunning(day)) return 0.0;
		
		int population = frozen.living();
		if(population == 0) return 0.0;
		
		double prevalence = (double)frozen.active() / population;
		return clamp(campaign.getDailyRate() * BehaviorModel.vaccinationWillingness(prevalence, campaign.getReferencePrevalence()));
	}
	
	/**
	 * Daily probability of moving from source to target for one cell.
	 */
	double probability(Compartment source, Compartment target, BehaviorClass behavior, int days, double infectiousContacts)
	{
		switch(source)
		{
			case S:
				return BehaviorModel.exposureProbability(params.getTransmissionProbability(), exposureDiscount(behavior), infectiousContacts);
				
			case E:
				return days >= params.getMinIncubationDays() ? params.getIncubationRate() : 0.0;
				
			case I:
				switch(target)
				{
					case J3:
						return params.getSymptomRate() * (1 - severeFraction(behavior));
					case J4:
						return params.getSymptomRate() * severeFraction(behavior);
					default:
						return params.getRecoveryRate();
				}
				
			case J3:
				switch(target)
				{
					case R:
						return days >= params.getMinHospitalDays() ? params.getHospitalDischargeRate() : 0.0;
					case J4:
						return params.getWorseningRate() * severityDiscount(behavior);
					default:
						return params.getHospitalDeathRate();
				}
				
			case J4:
				if(target == Compartment.R)
					return days >= params.getMinIcuDays() ? params.getIcuDischargeRate() : 0.0;
				return params.getIcuDeathRate();
				
			case R:
				return params.isWaningImmunity() ? params.getWaningRate() : 0.0;
				
			default:
				throw new IllegalArgumentException("No transitions out of " + source);
		}
	}
	
	private double exposureDiscount(BehaviorClass behavior)
	{
		double discount = 1.0;
		if(behavior.isPrudent())
			discount *= 1 - params.getPrudenceDiscount();
		if(behavior.isVaccinated())
			discount *= 1 - params.getVaccinationDiscount();
		return discount;
	}
	
	private double severityDiscount(BehaviorClass behavior)
	{
		return behavior.isVaccinated() ? 1 - params.getVaccinationSeverityDiscount() : 1.0;
	}
	
	private double severeFraction(BehaviorClass behavior)
	{
		return params.getSevereFraction() * severityDiscount(behavior);
	}
	
	/**
	 * All compartments ordered by how many individuals the province holds in
	 * them at the start of the day (deaths for DECEASED), fewest first.
	 */
	public static List<Compartment> priorityOrder(Province province)
	{
		final int[] counts = new int[Compartment.values().length];
		for(Compartment compartment : Compartment.values())
			counts[compartment.ordinal()] = province.count(compartment);
		
		List<Compartment> order = new ArrayList<Compartment>(Arrays.asList(Compartment.values()));
		Collections.sort(order, new Comparator<Compartment>()
		{
			public int compare(Compartment a, Compartment b)
			{
				int byCount = Integer.compare(counts[a.ordinal()], counts[b.ordinal()]);
				return byCount != 0 ? byCount : Integer.compare(a.ordinal(), b.ordinal());
			}
		});
		return order;
	}
	
	private static Compartment[] targets(Compartment source, List<Compartment> priority)
	{
		EnumSet<Compartment> reachable = TRANSITIONS.get(source);
		List<Compartment> targets = new ArrayList<Compartment>();
		for(Compartment compartment : priority)
		{
			if(reachable.contains(compartment))
				targets.add(compartment);
		}
		return targets.toArray(new Compartment[targets.size()]);
	}
	
	private static double clamp(double p)
	{
		if(!(p > 0)) return 0.0;
		return Math.min(p, 1.0);
	}
	
	private static class Admission
	{
		final Compartment source;
		final BehaviorClass behavior;
		final int days;
		final Severity severity;
		final int count;
		
		Admission(Compartment source, BehaviorClass behavior, int days, Severity severity, int count)
		{
			this.source = source;
			this.behavior = behavior;
			this.days = days;
			this.severity = severity;
			this.count = count;
		}
	}
}
