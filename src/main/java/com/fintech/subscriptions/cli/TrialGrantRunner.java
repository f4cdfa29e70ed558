package com.fintech.subscriptions.cli;

import com.fintech.subscriptions.dto.GrantOutcome;
import com.fintech.subscriptions.service.SubscriptionLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Administrative grant of a free trial, or a revocation with {@code --days=0}.
 * <p>
 * Usage: {@code java -jar subscription-tracker.jar --spring.profiles.active=grant-trial --username=alice --days=7}
 * <p>
 * Invalid arguments or a database failure make the run fail, which exits the process
 * with a non-zero status.
 */
@Component
@Profile("grant-trial")
@RequiredArgsConstructor
@Slf4j
public class TrialGrantRunner implements ApplicationRunner {

    static final String USAGE = "Usage: --spring.profiles.active=grant-trial --username=<name> --days=<days>";

    private final SubscriptionLedger ledger;

    @Override
    public void run(ApplicationArguments args) {
        String username = requiredOption(args, "username");
        int days = parseDays(requiredOption(args, "days"));

        GrantOutcome outcome = ledger.grantTrial(username, days);
        switch (outcome) {
            case GRANTED -> log.info("Free trial of {} days granted to {}", days, username);
            case REVOKED -> log.info("Subscription of {} revoked", username);
            case UNCHANGED -> log.info("Subscription of {} left unchanged", username);
            default -> log.info("Trial grant for {} finished with {}", username, outcome);
        }
        ledger.findSubscription(username).ifPresent(subscription ->
                log.info("Subscription of {} expires at {} (active: {})",
                        username, subscription.getExpirationDate(), subscription.isActive()));
    }

    private static String requiredOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new IllegalArgumentException("Missing --" + name + ". " + USAGE);
        }
        return values.get(0);
    }

    private static int parseDays(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Days must be a whole number, got '" + value + "'. " + USAGE, e);
        }
    }
}
