package my.rebalancer.app.service;

import my.rebalancer.app.config.AppProperties;
import my.rebalancer.app.domain.Allocation;
import my.rebalancer.app.domain.Holding;
import my.rebalancer.app.domain.Portfolio;
import my.rebalancer.app.domain.PriceLookup;
import my.rebalancer.app.domain.RebalanceResult;
import my.rebalancer.app.domain.Stock;
import my.rebalancer.app.domain.Trade;
import my.rebalancer.app.dto.HoldingRequestDto;
import my.rebalancer.app.dto.PortfolioSummaryDto;
import my.rebalancer.app.dto.PositionSummaryDto;
import my.rebalancer.app.dto.QuoteDto;
import my.rebalancer.app.dto.RebalanceRequestDto;
import my.rebalancer.app.dto.RebalanceResponseDto;
import my.rebalancer.app.dto.TradeDto;
import my.rebalancer.app.util.Decimals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class RebalanceService {
	private static final Logger logger = LoggerFactory.getLogger(RebalanceService.class);

	private final AppProperties properties;

	public RebalanceService(AppProperties properties) {
		this.properties = properties;
	}

	public RebalanceResponseDto rebalance(RebalanceRequestDto request) {
		Portfolio portfolio = toPortfolio(request);
		BigDecimal threshold = Decimals.toDecimalOrDefault(request.threshold(), defaultThreshold());
		RebalanceResult result = portfolio.rebalance(threshold);
		logger.info("Rebalance computed (tickers={}, trades={}, warnings={}, threshold={})",
				portfolio.allocation().tickers().size(), result.trades().size(), result.warnings().size(),
				threshold.toPlainString());
		if (!result.warnings().isEmpty()) {
			logger.debug("Rebalance warnings: {}", result.warnings());
		}
		return toDto(result);
	}

	public PortfolioSummaryDto summarize(RebalanceRequestDto request) {
		Portfolio portfolio = toPortfolio(request);
		Map<String, BigDecimal> weights = portfolio.currentWeights();
		List<PositionSummaryDto> positions = new ArrayList<>();
		for (Holding holding : portfolio.holdings()) {
			positions.add(new PositionSummaryDto(
					holding.ticker(),
					holding.shares(),
					holding.price(),
					holding.marketValue(),
					weights.get(holding.ticker()),
					portfolio.allocation().weightOf(holding.ticker())
			));
		}
		return new PortfolioSummaryDto(
				portfolio.totalValue(),
				portfolio.cash(),
				portfolio.cashWeight(),
				positions,
				portfolio.targetValues()
		);
	}

	Portfolio toPortfolio(RebalanceRequestDto request) {
		if (request == null) {
			throw new IllegalArgumentException("Rebalance request is required");
		}
		if (request.allocation() == null || request.allocation().isEmpty()) {
			throw new IllegalArgumentException("Allocation is required");
		}
		Allocation allocation = Allocation.of(request.allocation(), allocationTolerance());
		List<Holding> holdings = new ArrayList<>();
		if (request.holdings() != null) {
			for (HoldingRequestDto holding : request.holdings()) {
				if (holding == null) {
					throw new IllegalArgumentException("Holdings cannot contain null entries");
				}
				holdings.add(Holding.of(holding.ticker(), holding.price(), holding.shares()));
			}
		}
		List<Stock> quotes = new ArrayList<>();
		if (request.quotes() != null) {
			for (QuoteDto quote : request.quotes()) {
				if (quote == null) {
					throw new IllegalArgumentException("Quotes cannot contain null entries");
				}
				quotes.add(Stock.of(quote.ticker(), quote.price()));
			}
		}
		return new Portfolio(holdings, allocation, request.cash(), PriceLookup.of(quotes));
	}

	private RebalanceResponseDto toDto(RebalanceResult result) {
		List<TradeDto> trades = result.trades().stream()
				.map(this::toDto)
				.toList();
		return new RebalanceResponseDto(
				trades,
				result.warnings(),
				result.totalBuyValue(),
				result.totalSellValue(),
				result.netCashFlow(),
				result.isBalanced()
		);
	}

	private TradeDto toDto(Trade trade) {
		return new TradeDto(trade.ticker(), trade.action(), trade.shares(), trade.value());
	}

	private BigDecimal defaultThreshold() {
		AppProperties.Rebalancer rebalancer = properties.rebalancer();
		if (rebalancer == null || rebalancer.defaultThreshold() == null) {
			return BigDecimal.ZERO;
		}
		return rebalancer.defaultThreshold();
	}

	private BigDecimal allocationTolerance() {
		AppProperties.Rebalancer rebalancer = properties.rebalancer();
		if (rebalancer == null || rebalancer.allocationTolerance() == null) {
			return Allocation.DEFAULT_SUM_TOLERANCE;
		}
		return rebalancer.allocationTolerance();
	}
}
