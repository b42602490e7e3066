package my.rebalancer.app.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortfolioTest {
	private static final Allocation EVEN = Allocation.of(Map.of("A", "0.5", "B", "0.5"));

	@Test
	void rejectsDuplicateHoldings() {
		List<Holding> holdings = List.of(Holding.of("AAPL", 100, 10), Holding.of("AAPL", 110, 5));

		assertThatThrownBy(() -> new Portfolio(holdings, EVEN, BigDecimal.ZERO))
				.isInstanceOf(DuplicateHoldingException.class)
				.hasMessageContaining("AAPL");
	}

	@Test
	void duplicateHoldingCheckIgnoresCase() {
		List<Holding> holdings = List.of(Holding.of("aapl", 100, 10), Holding.of("AAPL", 100, 5));

		assertThatThrownBy(() -> new Portfolio(holdings, EVEN, BigDecimal.ZERO))
				.isInstanceOf(DuplicateHoldingException.class);
	}

	@Test
	void rejectsNegativeCash() {
		assertThatThrownBy(() -> new Portfolio(List.of(), EVEN, new BigDecimal("-100")))
				.isInstanceOf(NegativeCashException.class);
	}

	@Test
	void missingCashCountsAsZero() {
		Portfolio portfolio = new Portfolio(List.of(Holding.of("A", 100, 10)), EVEN, null);

		assertThat(portfolio.cash()).isEqualByComparingTo("0");
		assertThat(portfolio.totalValue()).isEqualByComparingTo("1000");
	}

	@Test
	void totalValueIncludesCash() {
		Portfolio portfolio = new Portfolio(
				List.of(Holding.of("A", 100, 10), Holding.of("B", 200, 5)),
				EVEN,
				new BigDecimal("500"));

		assertThat(portfolio.totalValue()).isEqualByComparingTo("2500");
	}

	@Test
	void currentWeightsAreShareOfTotal() {
		Portfolio portfolio = new Portfolio(
				List.of(Holding.of("A", 100, 75), Holding.of("B", 100, 25)),
				EVEN,
				BigDecimal.ZERO);

		Map<String, BigDecimal> weights = portfolio.currentWeights();

		assertThat(weights.get("A")).isEqualByComparingTo("0.75");
		assertThat(weights.get("B")).isEqualByComparingTo("0.25");
		assertThat(portfolio.cashWeight()).isEqualByComparingTo("0");
	}

	@Test
	void weightsAreZeroForEmptyPortfolio() {
		Portfolio portfolio = new Portfolio(List.of(Holding.of("A", 0, 10)), EVEN, BigDecimal.ZERO);

		assertThat(portfolio.currentWeights().get("A")).isEqualByComparingTo("0");
		assertThat(portfolio.cashWeight()).isEqualByComparingTo("0");
	}

	@Test
	void targetValuesFollowAllocation() {
		Portfolio portfolio = new Portfolio(List.of(Holding.of("A", 100, 30)), EVEN, new BigDecimal("1000"));

		assertThat(portfolio.targetValues())
				.containsOnlyKeys("A", "B")
				.satisfies(targets -> {
					assertThat(targets.get("A")).isEqualByComparingTo("2000");
					assertThat(targets.get("B")).isEqualByComparingTo("2000");
				});
	}

	@Test
	void withHoldingReturnsExtendedCopy() {
		Portfolio portfolio = new Portfolio(List.of(Holding.of("A", 100, 10)), EVEN, BigDecimal.ZERO);

		Portfolio extended = portfolio.withHolding(Holding.of("B", 100, 10));

		assertThat(extended.holdings()).extracting(Holding::ticker).containsExactly("A", "B");
		assertThat(portfolio.holdings()).hasSize(1);
		assertThatThrownBy(() -> extended.withHolding(Holding.of("b", 110, 1)))
				.isInstanceOf(DuplicateHoldingException.class);
	}

	@Test
	void withAllocationReplacesTargets() {
		Portfolio portfolio = new Portfolio(List.of(Holding.of("A", 100, 10)), EVEN, BigDecimal.ZERO);
		Allocation allIn = Allocation.of(Map.of("A", "1"));

		Portfolio updated = portfolio.withAllocation(allIn);

		assertThat(updated.allocation()).isEqualTo(allIn);
		assertThat(portfolio.allocation()).isEqualTo(EVEN);
		assertThat(updated.rebalance().isBalanced()).isTrue();
	}

	@Test
	void holdingLookupIgnoresCase() {
		Portfolio portfolio = new Portfolio(List.of(Holding.of("A", 100, 10)), EVEN, BigDecimal.ZERO);

		assertThat(portfolio.holding("a")).isPresent();
		assertThat(portfolio.holding("B")).isEmpty();
	}

	@Test
	void holdingsAreReadOnly() {
		Portfolio portfolio = new Portfolio(List.of(Holding.of("A", 100, 10)), EVEN, BigDecimal.ZERO);

		assertThatThrownBy(() -> portfolio.holdings().add(Holding.of("B", 1, 1)))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void requiresAllocation() {
		assertThatThrownBy(() -> new Portfolio(List.of(), null, BigDecimal.ZERO))
				.isInstanceOf(NullPointerException.class);
	}
}
