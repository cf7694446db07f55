package org.javai.kconfig.symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.javai.kconfig.ast.Expr;
import org.javai.kconfig.ast.SymbolKind;
import org.javai.kconfig.eval.Tristate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DependencyResolverTest {

	private static final String FEATURES = """
			config BASE_LIB
				bool "Base library"

			config FEATURE_A
				bool "Feature A"
				depends on BASE_LIB
				select HELPER_MODULE

			config HELPER_MODULE
				bool "Helper module"

			config FEATURE_B
				bool "Feature B"
				imply OPTIONAL_FEATURE

			config OPTIONAL_FEATURE
				bool "Optional feature"

			choice TRANSPORT
				prompt "Transport"
			config TRANSPORT_TCP
				bool "TCP"
			config TRANSPORT_UDP
				bool "UDP"
			endchoice
			""";

	private SymbolTable table;
	private DependencyResolver resolver;

	@BeforeEach
	void setUp() {
		table = SymbolTableBuilderTest.build(FEATURES);
		resolver = new DependencyResolver(table);
	}

	private static DependencyResolver resolverFor(String text) {
		return new DependencyResolver(SymbolTableBuilderTest.build(text));
	}

	private static ResolutionError rejection(SetResult result) {
		assertThat(result).isInstanceOf(SetResult.Rejected.class);
		return ((SetResult.Rejected) result).error();
	}

	private static Effects effects(SetResult result) {
		assertThat(result).isInstanceOf(SetResult.Applied.class);
		return ((SetResult.Applied) result).effects();
	}

	@Test
	void enablingWithUnmetDependencyIsRejected() {
		SetResult result = resolver.set("FEATURE_A", Tristate.Y);

		ResolutionError error = rejection(result);
		assertThat(error).isInstanceOf(ResolutionError.DependencyUnmet.class);
		ResolutionError.DependencyUnmet unmet = (ResolutionError.DependencyUnmet) error;
		assertThat(unmet.symbolId()).isEqualTo("FEATURE_A");
		assertThat(unmet.unmetExpression()).isEqualTo(Expr.symbol("BASE_LIB"));
		assertThat(unmet.unmetSymbols()).containsExactly("BASE_LIB");
		assertThat(unmet.message()).isEqualTo("FEATURE_A depends on BASE_LIB; not satisfied: BASE_LIB");
		assertThat(table.tristate("FEATURE_A")).isEqualTo(Tristate.N);
	}

	@Test
	void enablingCascadesSelectsAndBlocksDisablingTheTarget() {
		assertThat(resolver.set("BASE_LIB", Tristate.Y).isApplied()).isTrue();

		SetResult enabled = resolver.set("FEATURE_A", Tristate.Y);

		assertThat(effects(enabled).cascaded()).containsExactly("HELPER_MODULE");
		assertThat(table.tristate("HELPER_MODULE")).isEqualTo(Tristate.Y);
		assertThat(table.symbol("HELPER_MODULE").orElseThrow().origin()).isEqualTo(ValueOrigin.SELECT);

		ResolutionError error = rejection(resolver.set("HELPER_MODULE", Tristate.N));
		assertThat(error).isEqualTo(new ResolutionError.SelectedBy("HELPER_MODULE", List.of("FEATURE_A")));
		assertThat(table.tristate("HELPER_MODULE")).isEqualTo(Tristate.Y);
	}

	@Test
	void implyProducesSuggestionsWithoutApplyingThem() {
		SetResult result = resolver.set("FEATURE_B", Tristate.Y);

		assertThat(effects(result).suggestions())
				.containsExactly(new ImplySuggestion("OPTIONAL_FEATURE", Tristate.Y, "FEATURE_B"));
		assertThat(table.tristate("OPTIONAL_FEATURE")).isEqualTo(Tristate.N);

		assertThat(resolver.set("OPTIONAL_FEATURE", Tristate.Y).isApplied()).isTrue();
		assertThat(table.tristate("OPTIONAL_FEATURE")).isEqualTo(Tristate.Y);
	}

	@Test
	void implyDoesNotSuggestWhatIsAlreadySet() {
		resolver.set("OPTIONAL_FEATURE", Tristate.Y);

		assertThat(effects(resolver.set("FEATURE_B", Tristate.Y)).suggestions()).isEmpty();
	}

	@Test
	void secondChoiceMemberCannotBeSetWhileAnotherHoldsYes() {
		assertThat(table.tristate("TRANSPORT_TCP")).isEqualTo(Tristate.Y);

		ResolutionError error = rejection(resolver.set("TRANSPORT_UDP", Tristate.Y));

		assertThat(error).isEqualTo(
				new ResolutionError.ChoiceExclusivityViolation("TRANSPORT_UDP", "TRANSPORT", "TRANSPORT_TCP"));
		assertThat(table.tristate("TRANSPORT_UDP")).isEqualTo(Tristate.N);
	}

	@Test
	void choiceMemberCanBeSwitchedAfterDeselectingTheCurrentOne() {
		assertThat(resolver.set("TRANSPORT_TCP", Tristate.N).isApplied()).isTrue();
		assertThat(resolver.set("TRANSPORT_UDP", Tristate.Y).isApplied()).isTrue();

		assertThat(table.tristate("TRANSPORT_TCP")).isEqualTo(Tristate.N);
		assertThat(table.tristate("TRANSPORT_UDP")).isEqualTo(Tristate.Y);
	}

	@Test
	void settingTheCurrentValueIsANoOp() {
		SetResult result = resolver.set("BASE_LIB", "n");

		assertThat(result).isEqualTo(new SetResult.Applied("BASE_LIB", "n", Effects.none()));
		assertThat(effects(result).isEmpty()).isTrue();
		assertThat(table.symbol("BASE_LIB").orElseThrow().origin()).isEqualTo(ValueOrigin.DEFAULT);
	}

	@Test
	void rejectedRequestLeavesTableUnchanged() {
		resolver.set("BASE_LIB", Tristate.Y);
		resolver.set("FEATURE_A", Tristate.Y);
		Map<String, String> before = table.values();

		rejection(resolver.set("HELPER_MODULE", Tristate.N));
		rejection(resolver.set("TRANSPORT_UDP", Tristate.Y));
		rejection(resolver.set("NOPE", Tristate.Y));
		rejection(resolver.set("BASE_LIB", "maybe"));

		assertThat(table.values()).isEqualTo(before);
	}

	@Test
	void unknownSymbolIsRejected() {
		assertThat(rejection(resolver.set("NOPE", "y")))
				.isEqualTo(new ResolutionError.UndefinedSymbol("NOPE"));
	}

	@Test
	void malformedValuesAreRejected() {
		DependencyResolver numbers = resolverFor("""
				config FLAG
					bool "Flag"
				config COUNT
					int "Count"
				config ADDR
					hex "Address"
				""");

		assertThat(rejection(numbers.set("FLAG", "m")))
				.isEqualTo(new ResolutionError.InvalidValue("FLAG", SymbolKind.BOOL, "m"));
		assertThat(rejection(numbers.set("COUNT", "ten")))
				.isInstanceOf(ResolutionError.InvalidValue.class);
		assertThat(rejection(numbers.set("ADDR", "0xZZ")).message())
				.isEqualTo("'0xZZ' is not a valid hex value for ADDR");
	}

	@Test
	void valuesAreStoredInCanonicalForm() {
		DependencyResolver numbers = resolverFor("""
				config FLAG
					bool "Flag"
				config COUNT
					int "Count"
				config ADDR
					hex "Address"
				config NAME
					string "Name"
				""");

		assertThat(numbers.set("FLAG", "Y")).isEqualTo(new SetResult.Applied("FLAG", "y", Effects.none()));
		numbers.set("COUNT", " 042 ");
		numbers.set("ADDR", "FF00");
		numbers.set("NAME", "hello world");

		assertThat(numbers.table().valueOf("COUNT")).contains("42");
		assertThat(numbers.table().valueOf("ADDR")).contains("0xff00");
		assertThat(numbers.table().valueOf("NAME")).contains("hello world");
	}

	@Test
	void raisingTristateToYesNeedsDependencyAtYes() {
		DependencyResolver modules = resolverFor("""
				config BUS
					tristate "Bus"
					default m
				config DEVICE
					tristate "Device"
					depends on BUS
				""");

		assertThat(modules.set("DEVICE", Tristate.M).isApplied()).isTrue();
		ResolutionError error = rejection(modules.set("DEVICE", Tristate.Y));
		assertThat(error).isInstanceOf(ResolutionError.DependencyUnmet.class);
		assertThat(((ResolutionError.DependencyUnmet) error).unmetSymbols()).containsExactly("BUS");
		assertThat(modules.table().tristate("DEVICE")).isEqualTo(Tristate.M);
	}

	@Test
	void moduleSelectForcesModuleLevel() {
		DependencyResolver modules = resolverFor("""
				config DRIVER
					tristate "Driver"
					select LIB
				config LIB
					tristate "Library"
				""");

		modules.set("DRIVER", Tristate.M);

		assertThat(modules.table().tristate("LIB")).isEqualTo(Tristate.M);
		assertThat(modules.set("LIB", Tristate.Y).isApplied()).isTrue();
		assertThat(modules.set("LIB", Tristate.M).isApplied()).isTrue();
		assertThat(rejection(modules.set("LIB", Tristate.N)))
				.isEqualTo(new ResolutionError.SelectedBy("LIB", List.of("DRIVER")));
	}

	@Test
	void guardedSelectOnlyAppliesWhileGuardHolds() {
		DependencyResolver guarded = resolverFor("""
				config GUARD
					bool "Guard"
				config SRC
					bool "Source"
					select TARGET if GUARD
				config TARGET
					bool "Target"
				""");

		assertThat(effects(guarded.set("SRC", Tristate.Y)).cascaded()).isEmpty();
		assertThat(guarded.table().tristate("TARGET")).isEqualTo(Tristate.N);

		assertThat(effects(guarded.set("GUARD", Tristate.Y)).cascaded()).containsExactly("TARGET");
		assertThat(guarded.table().tristate("TARGET")).isEqualTo(Tristate.Y);
	}

	@Test
	void cascadeReachesEverySymbolBehindActiveSelects() {
		DependencyResolver chain = resolverFor("""
				config TOP
					bool "Top"
					select MIDDLE
				config MIDDLE
					bool
					select BOTTOM
					select SKIPPED if OFF
				config BOTTOM
					tristate
				config SKIPPED
					bool
				config OFF
					bool
				""");

		SetResult result = chain.set("TOP", Tristate.Y);

		assertThat(effects(result).cascaded()).containsExactly("MIDDLE", "BOTTOM");
		for (String id : List.of("MIDDLE", "BOTTOM")) {
			assertThat(chain.table().tristate(id).isAtLeast(Tristate.M)).as(id).isTrue();
		}
		assertThat(chain.table().tristate("SKIPPED")).isEqualTo(Tristate.N);
	}

	@Test
	void cyclicSelectsTerminate() {
		DependencyResolver cyclic = resolverFor("""
				config A
					bool "A"
					select B
				config B
					bool "B"
					select A
				""");

		SetResult result = cyclic.set("A", Tristate.Y);

		assertThat(effects(result).cascaded()).containsExactly("B");
		assertThat(cyclic.table().tristate("A")).isEqualTo(Tristate.Y);
		assertThat(cyclic.table().tristate("B")).isEqualTo(Tristate.Y);
	}

	@Test
	void disablingReportsOrphanedSelectionsWithoutChangingThem() {
		resolver.set("BASE_LIB", Tristate.Y);
		resolver.set("FEATURE_A", Tristate.Y);

		SetResult result = resolver.set("FEATURE_A", Tristate.N);

		assertThat(effects(result).orphanedSelections()).containsExactly("HELPER_MODULE");
		assertThat(table.tristate("HELPER_MODULE")).isEqualTo(Tristate.Y);
		assertThat(resolver.set("HELPER_MODULE", Tristate.N).isApplied()).isTrue();
	}

	@Test
	void selectionStillRequiredElsewhereIsNotOrphaned() {
		DependencyResolver shared = resolverFor("""
				config ONE
					bool "One"
					select SHARED
				config TWO
					bool "Two"
					select SHARED
				config SHARED
					bool
				""");
		shared.set("ONE", Tristate.Y);
		shared.set("TWO", Tristate.Y);

		SetResult result = shared.set("ONE", Tristate.N);

		assertThat(effects(result).orphanedSelections()).isEmpty();
		assertThat(rejection(shared.set("SHARED", Tristate.N)))
				.isEqualTo(new ResolutionError.SelectedBy("SHARED", List.of("TWO")));
	}

	@Test
	void userSetSymbolsAreNotOrphaned() {
		resolver.set("HELPER_MODULE", Tristate.Y);
		resolver.set("BASE_LIB", Tristate.Y);
		resolver.set("FEATURE_A", Tristate.Y);

		assertThat(effects(resolver.set("FEATURE_A", Tristate.N)).orphanedSelections()).isEmpty();
	}

	@Test
	void activeSelectsAlwaysHoldTheirTargetsUp() {
		DependencyResolver mixed = resolverFor("""
				config GUARD
					bool "Guard"
				config A
					tristate "A"
					select B
					select C if GUARD
				config B
					tristate "B"
					select C
				config C
					tristate "C"
				config D
					bool "D"
					select B
				""");
		String[][] requests = {
				{"A", "m"}, {"B", "n"}, {"D", "y"}, {"B", "m"}, {"GUARD", "y"}, {"C", "n"},
				{"A", "y"}, {"D", "n"}, {"B", "n"}, {"A", "n"}, {"B", "n"}, {"C", "n"}, {"GUARD", "n"}
		};

		for (String[] request : requests) {
			mixed.set(request[0], request[1]);
			for (Symbol symbol : mixed.table().symbols()) {
				Tristate forced = mixed.table().forcedLevel(symbol.id());
				assertThat(symbol.tristate().isAtLeast(forced))
						.as("%s after set(%s, %s)", symbol.id(), request[0], request[1])
						.isTrue();
			}
		}
	}

	@Test
	void concurrentRequestsKeepTheTableConsistent() throws Exception {
		resolver.set("BASE_LIB", Tristate.Y);
		ExecutorService executor = Executors.newFixedThreadPool(4);
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (int i = 0; i < 4; i++) {
				int worker = i;
				futures.add(executor.submit(() -> {
					for (int n = 0; n < 200; n++) {
						boolean on = (n + worker) % 2 == 0;
						resolver.set("FEATURE_A", on ? "y" : "n");
						resolver.set("FEATURE_B", on ? "n" : "y");
					}
				}));
			}
			for (Future<?> future : futures) {
				future.get();
			}
		}
		finally {
			executor.shutdownNow();
		}

		if (table.tristate("FEATURE_A") == Tristate.Y) {
			assertThat(table.tristate("HELPER_MODULE")).isEqualTo(Tristate.Y);
		}
	}

	@Test
	void resolversOverOneTableShareOneExclusiveSection() throws Exception {
		DependencyResolver second = new DependencyResolver(table);
		ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			Future<SetResult> pending;
			synchronized (table) {
				pending = executor.submit(() -> second.set("BASE_LIB", Tristate.Y));

				assertThatThrownBy(() -> pending.get(200, TimeUnit.MILLISECONDS))
						.isInstanceOf(TimeoutException.class);
				assertThat(table.tristate("BASE_LIB")).isEqualTo(Tristate.N);
			}
			assertThat(pending.get(5, TimeUnit.SECONDS).isApplied()).isTrue();
			assertThat(table.tristate("BASE_LIB")).isEqualTo(Tristate.Y);
		}
		finally {
			executor.shutdownNow();
		}
	}

	@Test
	void loweringCanRaiseTargetsOfNegatedSelectGuards() {
		DependencyResolver guarded = resolverFor("""
				config C
					bool "C"
					default y
				config S
					bool "S"
					default y
					select X if !C
				config X
					bool "X"
				""");
		assertThat(guarded.table().tristate("X")).isEqualTo(Tristate.N);

		SetResult result = guarded.set("C", Tristate.N);

		assertThat(result).isInstanceOf(SetResult.Applied.class);
		assertThat(((SetResult.Applied) result).effects().cascaded()).containsExactly("X");
		assertThat(guarded.table().tristate("C")).isEqualTo(Tristate.N);
		assertThat(guarded.table().tristate("X")).isEqualTo(Tristate.Y);
		assertThat(guarded.table().tristate("S")).isEqualTo(Tristate.Y);
	}

	@Test
	void requiresTable() {
		assertThatThrownBy(() -> new DependencyResolver(null))
				.isInstanceOf(NullPointerException.class)
				.hasMessage("table must not be null");
	}
}
