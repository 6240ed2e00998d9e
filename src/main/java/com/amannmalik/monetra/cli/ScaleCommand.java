package com.amannmalik.monetra.cli;

import com.amannmalik.monetra.api.money.Money;
import com.amannmalik.monetra.api.result.Outcome;
import com.amannmalik.monetra.api.rounding.RoundingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/// {@code multiply} and {@code divide}: an amount scaled by an exact decimal factor.
abstract class ScaleCommand extends MonetaryCommand {
    private static final Logger LOG = LoggerFactory.getLogger(ScaleCommand.class);

    @CommandLine.Parameters(index = "0", description = "Amount in major units, e.g. 19.99")
    String amount;
    @CommandLine.Parameters(index = "1", description = "Decimal factor, e.g. 0.555")
    String factor;
    @CommandLine.Option(names = "--policy", description = "Rounding policy for inexact results (default: none, inexact results fail)")
    String policy;

    abstract Outcome<Money> apply(Money money, String factor, RoundingPolicy policy);

    @Override
    public Integer call() {
        var currency = currency();
        LOG.debug("{} {} by {} (policy {})", spec.name(), amount, factor, policy);
        Outcome<Money> outcome = policy(policy).flatMap(rounding -> Money.parse(amount, currency)
                .flatMap(money -> apply(money, factor, rounding.orElse(null))));
        return emit(outcome, this::render);
    }

    @CommandLine.Command(name = "multiply", description = "Multiply an amount by an exact decimal factor")
    public static final class Multiply extends ScaleCommand {
        public Multiply() {
        }

        @Override
        Outcome<Money> apply(Money money, String factor, RoundingPolicy policy) {
            return money.multiply(factor, policy);
        }
    }

    @CommandLine.Command(name = "divide", description = "Divide an amount by an exact decimal divisor")
    public static final class Divide extends ScaleCommand {
        public Divide() {
        }

        @Override
        Outcome<Money> apply(Money money, String factor, RoundingPolicy policy) {
            return money.divide(factor, policy);
        }
    }
}
