package com.work.escrow.demo.ledger;

import com.work.escrow.core.exception.EscrowException;
import com.work.escrow.core.exception.InsufficientFundsException;
import com.work.escrow.core.model.HeldFunds;
import com.work.escrow.core.model.Payment;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class InMemoryPaymentTransferTest {

    @Test
    public void escrow_then_release_restores_balance() {
        InMemoryPaymentTransfer t = new InMemoryPaymentTransfer();
        t.credit("buyer-1", BigInteger.valueOf(100));

        HeldFunds held = t.escrow("buyer-1", BigInteger.valueOf(60));
        assertEquals(BigInteger.valueOf(40), t.balanceOf("buyer-1"));
        assertEquals(BigInteger.valueOf(60), t.totalHeld());

        t.release(held, "buyer-1");
        assertEquals(BigInteger.valueOf(100), t.balanceOf("buyer-1"));
        assertEquals(BigInteger.ZERO, t.totalHeld());
    }

    @Test
    public void held_funds_can_only_be_disposed_once() {
        InMemoryPaymentTransfer t = new InMemoryPaymentTransfer();
        t.credit("buyer-1", BigInteger.TEN);
        HeldFunds held = t.escrow("buyer-1", BigInteger.TEN);

        Payment payment = t.forward(held);
        assertEquals("buyer-1", payment.getPayer());

        assertThrows(EscrowException.class, () -> t.release(held, "buyer-1"));
        assertThrows(EscrowException.class, () -> t.forward(held));
    }

    @Test
    public void escrow_beyond_balance_fails() {
        InMemoryPaymentTransfer t = new InMemoryPaymentTransfer();
        t.credit("buyer-1", BigInteger.ONE);

        assertThrows(InsufficientFundsException.class, () -> t.escrow("buyer-1", BigInteger.TEN));
        assertEquals(BigInteger.ONE, t.balanceOf("buyer-1"));
    }
}
