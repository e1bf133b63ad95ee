package com.gillianbc.networth.service;

import com.gillianbc.networth.model.AvatarState;
import com.gillianbc.networth.model.TimelinePoint;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Maps a net worth and debt pair onto one of four wealth tiers.
 */
@Service
public class WealthClassifier {

    static final BigDecimal WEALTHY_NET_WORTH = new BigDecimal("50000");
    static final BigDecimal THRIVING_NET_WORTH = new BigDecimal("10000");
    static final BigDecimal THRIVING_DEBT_RATIO = new BigDecimal("0.2");

    /**
     * Checked in order:
     * <ul>
     *     <li>wealthy: net worth above 50,000 and no debt</li>
     *     <li>thriving: net worth above 10,000 and debt below 20% of net worth</li>
     *     <li>stable: positive net worth and debt below net worth</li>
     *     <li>struggling: everything else</li>
     * </ul>
     */
    public AvatarState classify(BigDecimal netWorth, BigDecimal debt) {
        Objects.requireNonNull(netWorth, "netWorth must not be null");
        Objects.requireNonNull(debt, "debt must not be null");

        if (netWorth.compareTo(WEALTHY_NET_WORTH) > 0 && debt.signum() == 0) {
            return AvatarState.WEALTHY;
        }
        if (netWorth.compareTo(THRIVING_NET_WORTH) > 0 && debt.compareTo(netWorth.multiply(THRIVING_DEBT_RATIO)) < 0) {
            return AvatarState.THRIVING;
        }
        if (netWorth.signum() > 0 && debt.compareTo(netWorth) < 0) {
            return AvatarState.STABLE;
        }
        return AvatarState.STRUGGLING;
    }

    public AvatarState classify(TimelinePoint point) {
        Objects.requireNonNull(point, "point must not be null");
        return classify(point.getNetWorth(), point.getDebt());
    }
}
