package com.flagship.savings_loan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SavingsLoanApplication {

    public static void main(String[] args) {
        SpringApplication.run(SavingsLoanApplication.class, args);
    }
}
