package com.soora.shop.api.dto;

import com.soora.shop.domain.model.Address;

import java.time.Instant;

/**
 * Response DTO for a saved address.
 *
 * @author Soora Platform Team
 */
public class AddressResponse {

    private String id;
    private String userId;
    private Address.AddressType type;
    private String name;
    private String street;
    private String unit;
    private String building;
    private String postalCode;
    private String district;
    private Boolean isDefault;
    private String deliveryNotes;
    private Instant createdAt;
    private Instant updatedAt;

    public AddressResponse() {
    }

    public static AddressResponse fromEntity(Address address) {
        AddressResponse response = new AddressResponse();
        response.setId(address.getId());
        response.setUserId(address.getUserId());
        response.setType(address.getType());
        response.setName(address.getName());
        response.setStreet(address.getStreet());
        response.setUnit(address.getUnit());
        response.setBuilding(address.getBuilding());
        response.setPostalCode(address.getPostalCode());
        response.setDistrict(address.getDistrict());
        response.setIsDefault(address.getIsDefault());
        response.setDeliveryNotes(address.getDeliveryNotes());
        response.setCreatedAt(address.getCreatedAt());
        response.setUpdatedAt(address.getUpdatedAt());
        return response;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Address.AddressType getType() {
        return type;
    }

    public void setType(Address.AddressType type) {
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getStreet() {
        return street;
    }

    public void setStreet(String street) {
        this.street = street;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit;
    }

    public String getBuilding() {
        return building;
    }

    public void setBuilding(String building) {
        this.building = building;
    }

    public String getPostalCode() {
        return postalCode;
    }

    public void setPostalCode(String postalCode) {
        this.postalCode = postalCode;
    }

    public String getDistrict() {
        return district;
    }

    public void setDistrict(String district) {
        this.district = district;
    }

    public Boolean getIsDefault() {
        return isDefault;
    }

    public void setIsDefault(Boolean isDefault) {
        this.isDefault = isDefault;
    }

    public String getDeliveryNotes() {
        return deliveryNotes;
    }

    public void setDeliveryNotes(String deliveryNotes) {
        this.deliveryNotes = deliveryNotes;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
