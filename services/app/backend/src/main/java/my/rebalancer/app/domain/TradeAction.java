package my.rebalancer.app.domain;

import java.util.Locale;

public enum TradeAction {
	BUY,
	SELL;

	public boolean matches(String value) {
		return value != null && name().equals(value);
	}

	public static TradeAction from(String value) {
		String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
		for (TradeAction action : values()) {
			if (action.name().equals(normalized)) {
				return action;
			}
		}
		throw new IllegalArgumentException("Unknown trade action: " + value);
	}
}
