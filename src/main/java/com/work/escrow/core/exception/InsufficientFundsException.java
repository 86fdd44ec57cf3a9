package com.work.escrow.core.exception;

import java.math.BigInteger;

public class InsufficientFundsException extends EscrowException {

    public InsufficientFundsException(String account, BigInteger required, BigInteger available) {
        super("余额不足: account=" + account + ", required=" + required + ", available=" + available);
    }
}
