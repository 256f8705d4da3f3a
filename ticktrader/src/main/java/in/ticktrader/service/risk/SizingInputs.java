package in.ticktrader.service.risk;

import in.ticktrader.config.InstrumentConfig;

import java.math.BigDecimal;

/**
 * Instrument contract parameters needed to size a position. Either value
 * may be absent here; {@link RiskManager#open} refuses to size without them.
 */
public record SizingInputs(
    String instrumentId,
    Integer lotSize,
    BigDecimal tickSize
) {
    public static SizingInputs fromConfig(InstrumentConfig instrument) {
        return new SizingInputs(instrument.instrumentId(), instrument.lotSize(), instrument.tickSize());
    }

    public boolean isComplete() {
        return lotSize != null && lotSize > 0 && tickSize != null && tickSize.signum() > 0;
    }
}
