package com.amannmalik.monetra.cli;

import com.amannmalik.monetra.api.rounding.RoundingEngine;
import com.amannmalik.monetra.api.rounding.RoundingPolicy;
import com.amannmalik.monetra.codec.ErrorJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.math.BigInteger;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "round", description = "Divide two integers and round the quotient")
public final class RoundCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(RoundCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;
    @CommandLine.Parameters(index = "0", description = "Numerator")
    BigInteger numerator;
    @CommandLine.Parameters(index = "1", description = "Denominator")
    BigInteger denominator;
    @CommandLine.Option(names = "--policy", required = true, description = "One of HALF_UP, HALF_DOWN, HALF_EVEN, FLOOR, CEIL, TRUNCATE")
    String policy;

    public RoundCommand() {
    }

    @Override
    public Integer call() {
        LOG.debug("Rounding {}/{} with {}", numerator, denominator, policy);
        var outcome = RoundingPolicy.parse(policy)
                .flatMap(parsed -> RoundingEngine.roundedDivide(numerator, denominator, parsed));
        return outcome.fold(value -> {
            spec.commandLine().getOut().println(value);
            return MonetaryCommand.EXIT_OK;
        }, error -> {
            spec.commandLine().getErr().println(ErrorJson.toJson(error));
            return MonetaryCommand.EXIT_MONETARY_ERROR;
        });
    }
}
