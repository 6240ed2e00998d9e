package com.amannmalik.monetra.cli;

import com.amannmalik.monetra.api.money.Money;
import com.amannmalik.monetra.api.result.Outcome;
import com.amannmalik.monetra.api.rounding.RoundingPolicy;
import com.amannmalik.monetra.api.shared.CurrencyDescriptor;
import com.amannmalik.monetra.codec.ErrorJson;
import com.amannmalik.monetra.codec.MoneyJsonCodec;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;

/// Shared plumbing: result printing, error reporting and the currency options.
abstract class MonetaryCommand implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_MONETARY_ERROR = 1;

    @CommandLine.Spec
    CommandSpec spec;
    @CommandLine.Option(names = "--decimals", defaultValue = "2", description = "Minor-unit digits of the currency, 0-18 (default: ${DEFAULT-VALUE})")
    int decimals;
    @CommandLine.Option(names = "--currency", defaultValue = "XXX", description = "Currency code or token ticker (default: ${DEFAULT-VALUE})")
    String currencyCode;
    @CommandLine.Option(names = "--json", defaultValue = "false", description = "Print results as JSON")
    boolean json;

    final MoneyJsonCodec codec = new MoneyJsonCodec();

    CurrencyDescriptor currency() {
        try {
            return CurrencyDescriptor.of(currencyCode, decimals);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    /// A blank policy means "none given".
    Outcome<Optional<RoundingPolicy>> policy(String name) {
        if (name == null || name.isBlank()) {
            return Outcome.success(Optional.empty());
        }
        return RoundingPolicy.parse(name).map(Optional::of);
    }

    <T> int emit(Outcome<T> outcome, Function<T, String> render) {
        return outcome.fold(value -> {
            spec.commandLine().getOut().println(render.apply(value));
            return EXIT_OK;
        }, error -> {
            spec.commandLine().getErr().println(ErrorJson.toJson(error));
            return EXIT_MONETARY_ERROR;
        });
    }

    String render(Money money) {
        return json ? codec.toJson(money).toString() : money.toDecimalString();
    }

    String render(List<Money> parts) {
        if (json) {
            return codec.toJson(parts).toString();
        }
        return String.join(System.lineSeparator(), parts.stream().map(Money::toDecimalString).toList());
    }
}
