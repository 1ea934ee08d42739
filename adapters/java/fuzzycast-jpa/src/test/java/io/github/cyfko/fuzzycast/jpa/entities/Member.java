package io.github.cyfko.fuzzycast.jpa.entities;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import java.time.LocalDate;

/**
 * Test entity searched in the JPA integration tests.
 */
@Entity
@Table(name = "club_member")
public class Member extends BaseEntity {

    public enum Status {
        ACTIVE, SUSPENDED, CLOSED
    }

    @Column(name = "email")
    private String email;

    @Column(name = "password")
    private String password;

    @Column(name = "name")
    private String name;

    @Column(name = "age")
    private Integer age;

    @Column(name = "active")
    private Boolean active;

    @Enumerated(EnumType.STRING)
    private Status status;

    private LocalDate joinedOn;

    @ManyToOne(fetch = FetchType.LAZY)
    private Team team;

    protected Member() {}

    public Member(String name, String email, String password, Integer age, Boolean active,
                  Status status, LocalDate joinedOn, Team team) {
        this.name = name;
        this.email = email;
        this.password = password;
        this.age = age;
        this.active = active;
        this.status = status;
        this.joinedOn = joinedOn;
        this.team = team;
    }

    public String getEmail() {
        return email;
    }

    public String getName() {
        return name;
    }

    public Integer getAge() {
        return age;
    }

    public Boolean getActive() {
        return active;
    }

    public Status getStatus() {
        return status;
    }

    public LocalDate getJoinedOn() {
        return joinedOn;
    }

    public Team getTeam() {
        return team;
    }
}
