package com.amannmalik.monetra.cli;

import com.amannmalik.monetra.api.money.Money;
import com.amannmalik.monetra.api.result.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.util.List;

@CommandLine.Command(name = "allocate", description = "Split an amount by weights without losing a minor unit")
public final class AllocateCommand extends MonetaryCommand {
    private static final Logger LOG = LoggerFactory.getLogger(AllocateCommand.class);

    @CommandLine.Parameters(index = "0", description = "Amount in major units")
    String amount;
    @CommandLine.Parameters(index = "1..*", arity = "1..*", description = "Weights as decimal literals, e.g. 1 1 1 or 0.7 0.3")
    List<String> weights;

    public AllocateCommand() {
    }

    @Override
    public Integer call() {
        var currency = currency();
        LOG.debug("Allocating {} across {} weight(s)", amount, weights.size());
        Outcome<List<Money>> parts = Money.parse(amount, currency).flatMap(money -> money.allocateLiterals(weights));
        return emit(parts, this::render);
    }
}
