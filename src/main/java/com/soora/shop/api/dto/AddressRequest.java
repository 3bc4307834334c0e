package com.soora.shop.api.dto;

import com.soora.shop.domain.model.Address.AddressType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import jakarta.validation.groups.Default;

/**
 * Request DTO for creating or editing an address.
 * On create ({@link Create} group) type, street, postal code and district are required;
 * on update every field is optional and only supplied fields are written.
 *
 * @author Soora Platform Team
 */
public class AddressRequest {

    /**
     * Validation group for address creation.
     */
    public interface Create extends Default {
    }

    @NotNull(groups = Create.class, message = "Address type is required")
    private AddressType type;

    @Size(max = 100, message = "Name must be at most 100 characters")
    private String name;

    @NotBlank(groups = Create.class, message = "Street is required")
    @Size(max = 255, message = "Street must be at most 255 characters")
    private String street;

    @Size(max = 20, message = "Unit must be at most 20 characters")
    private String unit;

    @Size(max = 100, message = "Building must be at most 100 characters")
    private String building;

    @NotBlank(groups = Create.class, message = "Postal code is required")
    @Pattern(regexp = "^\\d{6}$", message = "Postal code must be 6 digits")
    private String postalCode;

    @NotBlank(groups = Create.class, message = "District is required")
    @Size(max = 100, message = "District must be at most 100 characters")
    private String district;

    private Boolean isDefault;

    @Size(max = 500, message = "Delivery notes must be at most 500 characters")
    private String deliveryNotes;

    public AddressRequest() {
    }

    // Getters and setters
    public AddressType getType() {
        return type;
    }

    public void setType(AddressType type) {
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
}
