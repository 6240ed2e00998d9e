package com.amannmalik.monetra.cli;

import com.amannmalik.monetra.api.money.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(name = "parse", description = "Convert a decimal literal into minor units")
public final class ParseCommand extends MonetaryCommand {
    private static final Logger LOG = LoggerFactory.getLogger(ParseCommand.class);

    @CommandLine.Parameters(index = "0", description = "Decimal literal, e.g. 10.50")
    String literal;

    public ParseCommand() {
    }

    @Override
    public Integer call() {
        var currency = currency();
        LOG.debug("Parsing '{}' with {} decimals", literal, currency.decimals());
        return emit(Money.parse(literal, currency),
                money -> json ? codec.toJson(money).toString() : money.minor().toString());
    }
}
