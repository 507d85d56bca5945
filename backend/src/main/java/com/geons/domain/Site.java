package com.geons.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Physical location hosting sliver tools. A site carries one or more metro tags (e.g. "lga", "lga01").
 */
@Document(collection = "sites")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Site {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String siteId;
    @Indexed
    private List<String> metro = new ArrayList<>();
    private String city;
    private String country;
    private double latitude;
    private double longitude;
}
