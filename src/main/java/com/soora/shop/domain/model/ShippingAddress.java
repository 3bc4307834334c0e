package com.soora.shop.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Address fields copied onto an order when it is placed.
 *
 * @author Soora Platform Team
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingAddress {

    @Column(name = "ship_label", length = 100)
    private String label;

    @Column(name = "ship_street", length = 255)
    private String street;

    @Column(name = "ship_unit", length = 20)
    private String unit;

    @Column(name = "ship_building", length = 100)
    private String building;

    @Column(name = "ship_postal_code", length = 10)
    private String postalCode;

    @Column(name = "ship_district", length = 100)
    private String district;

    @Column(name = "ship_delivery_notes", length = 500)
    private String deliveryNotes;

    public static ShippingAddress from(Address address) {
        return ShippingAddress.builder()
                .label(address.getName())
                .street(address.getStreet())
                .unit(address.getUnit())
                .building(address.getBuilding())
                .postalCode(address.getPostalCode())
                .district(address.getDistrict())
                .deliveryNotes(address.getDeliveryNotes())
                .build();
    }
}
