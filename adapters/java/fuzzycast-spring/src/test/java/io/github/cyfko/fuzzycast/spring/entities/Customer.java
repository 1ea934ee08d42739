package io.github.cyfko.fuzzycast.spring.entities;

import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "customer")
public class Customer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String name;

    private String email;

    private String passwordHash;

    private Integer loyaltyPoints;

    protected Customer() {}

    public Customer(String name, String email, String passwordHash, Integer loyaltyPoints) {
        this.name = name;
        this.email = email;
        this.passwordHash = passwordHash;
        this.loyaltyPoints = loyaltyPoints;
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public Integer getLoyaltyPoints() {
        return loyaltyPoints;
    }
}
