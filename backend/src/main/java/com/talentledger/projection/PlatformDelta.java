package com.talentledger.projection;

import java.math.BigInteger;

public record PlatformDelta(BigInteger volume, BigInteger fees, long paidMilestones) {

    public static final PlatformDelta NONE = new PlatformDelta(BigInteger.ZERO, BigInteger.ZERO, 0);

    public boolean isEmpty() {
        return paidMilestones == 0 && volume.signum() == 0 && fees.signum() == 0;
    }
}
