package com.flagship.agreement_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;

/**
 * The jdbc store builds its own data source when selected, so the default
 * data source auto-configuration stays off.
 */
@SpringBootApplication(exclude = {
    DataSourceAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class
})
public class AgreementLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgreementLedgerApplication.class, args);
    }
}
