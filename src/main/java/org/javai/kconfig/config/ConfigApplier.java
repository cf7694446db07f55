package org.javai.kconfig.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.kconfig.symbol.DependencyResolver;
import org.javai.kconfig.symbol.ResolutionError;
import org.javai.kconfig.symbol.SetResult;
import org.javai.kconfig.symbol.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies saved values to a freshly loaded table, as {@code oldconfig} does.
 * <p>
 * Every value goes through {@link DependencyResolver#set}, so a saved configuration can
 * never put the table into a state the resolver would refuse. Values are applied in
 * definition order; a rejected value is retried on later passes, because it may become
 * acceptable once other saved values are in place (a dependency enabled further down, or
 * the choice member it replaces switched off). Passes stop when one applies nothing.
 */
public class ConfigApplier {

	private static final Logger logger = LoggerFactory.getLogger(ConfigApplier.class);

	private final DependencyResolver resolver;

	public ConfigApplier(DependencyResolver resolver) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
	}

	public ApplyReport apply(Map<String, String> values) {
		Objects.requireNonNull(values, "values must not be null");

		List<String> unknown = new ArrayList<>();
		for (String id : values.keySet()) {
			if (!resolver.table().contains(id)) {
				logger.warn("Ignoring unknown symbol {} in saved configuration", id);
				unknown.add(id);
			}
		}

		List<String> pending = new ArrayList<>();
		for (Symbol symbol : resolver.table().symbols()) {
			if (values.containsKey(symbol.id())) {
				pending.add(symbol.id());
			}
		}

		List<String> applied = new ArrayList<>();
		Map<String, ResolutionError> rejected = new LinkedHashMap<>();
		// malformed values are final; they never reach a later pass
		Map<String, ResolutionError> invalid = new LinkedHashMap<>();
		int pass = 0;
		boolean progress = true;
		while (progress && !pending.isEmpty()) {
			pass++;
			progress = false;
			rejected.clear();
			List<String> retry = new ArrayList<>();
			for (String id : pending) {
				SetResult result = resolver.set(id, values.get(id));
				if (result instanceof SetResult.Rejected rejection) {
					if (rejection.error() instanceof ResolutionError.InvalidValue) {
						invalid.put(id, rejection.error());
					}
					else {
						rejected.put(id, rejection.error());
						retry.add(id);
					}
				}
				else {
					applied.add(id);
					progress = true;
				}
			}
			logger.debug("Pass {}: {} applied so far, {} pending", pass, applied.size(), retry.size());
			pending = retry;
		}

		Map<String, ResolutionError> notApplied = new LinkedHashMap<>(invalid);
		notApplied.putAll(rejected);
		notApplied.forEach((id, error) -> logger.warn("Saved value for {} not applied: {}", id, error.message()));
		return new ApplyReport(applied, notApplied, unknown);
	}

	/**
	 * Outcome of {@link #apply}.
	 *
	 * @param applied ids whose saved value was accepted, in the order they were applied
	 * @param rejected ids whose saved value was refused, with the last refusal
	 * @param unknown ids in the saved configuration that the tree does not define
	 */
	public record ApplyReport(List<String> applied, Map<String, ResolutionError> rejected, List<String> unknown) {

		public ApplyReport {
			applied = List.copyOf(applied);
			rejected = Collections.unmodifiableMap(new LinkedHashMap<>(rejected));
			unknown = List.copyOf(unknown);
		}

		public boolean isClean() {
			return rejected.isEmpty() && unknown.isEmpty();
		}
	}
}
