package com.ai.clinicdesk.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "branch")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Branch {

    @Id
    @Column(length = 20)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 255)
    private String address;

    @Column(length = 60)
    private String city;

    @Column(length = 30)
    private String phone;

    @Column(length = 100)
    private String email;

    @Column(name = "hours_weekdays", length = 60)
    private String hoursWeekdays;

    @Column(name = "hours_weekend", length = 60)
    private String hoursWeekend;

    @Column(name = "maps_url", length = 255)
    private String mapsUrl;

    @Column(length = 255)
    private String features;

    private Boolean parking;

    private Boolean accessibility;
}
