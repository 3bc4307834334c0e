package com.soora.shop.api.controller;

import com.soora.shop.api.dto.AddressRequest;
import com.soora.shop.api.dto.AddressResponse;
import com.soora.shop.api.dto.MessageResponse;
import com.soora.shop.api.dto.UpdateProfileRequest;
import com.soora.shop.api.dto.UserProfileResponse;
import com.soora.shop.security.CallerContext;
import com.soora.shop.security.SecurityUtils;
import com.soora.shop.service.AddressService;
import com.soora.shop.service.UserService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the caller's profile and address book.
 *
 * Authorization: every endpoint acts on the authenticated caller only; addresses of
 * other users answer 404.
 *
 * @author Soora Platform Team
 */
@RestController
@RequestMapping("/api/users")
@PreAuthorize("isAuthenticated()")
public class UserController {

    private final UserService userService;
    private final AddressService addressService;

    public UserController(UserService userService, AddressService addressService) {
        this.userService = userService;
        this.addressService = addressService;
    }

    @GetMapping("/profile")
    public ResponseEntity<UserProfileResponse> getProfile() {
        return ResponseEntity.ok(userService.getProfile(SecurityUtils.currentCaller()));
    }

    @PutMapping("/profile")
    public ResponseEntity<UserProfileResponse> updateProfile(@Valid @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(userService.updateProfile(SecurityUtils.currentCaller(), request));
    }

    @GetMapping("/addresses")
    public ResponseEntity<List<AddressResponse>> listAddresses() {
        return ResponseEntity.ok(addressService.listAddresses(SecurityUtils.currentCaller()));
    }

    /**
     * Create an address. With {@code isDefault=true} every other address of the caller
     * loses its default flag.
     *
     * @param request Address fields; type, street, postalCode and district are required
     * @return Created address (201)
     */
    @PostMapping("/addresses")
    public ResponseEntity<AddressResponse> createAddress(
            @Validated(AddressRequest.Create.class) @RequestBody AddressRequest request
    ) {
        CallerContext caller = SecurityUtils.currentCaller();
        return ResponseEntity.status(HttpStatus.CREATED).body(addressService.createAddress(caller, request));
    }

    @PutMapping("/addresses/{addressId}")
    public ResponseEntity<AddressResponse> updateAddress(
            @PathVariable String addressId,
            @Valid @RequestBody AddressRequest request
    ) {
        return ResponseEntity.ok(addressService.updateAddress(SecurityUtils.currentCaller(), addressId, request));
    }

    @DeleteMapping("/addresses/{addressId}")
    public ResponseEntity<MessageResponse> deleteAddress(@PathVariable String addressId) {
        addressService.deleteAddress(SecurityUtils.currentCaller(), addressId);
        return ResponseEntity.ok(new MessageResponse("Address deleted"));
    }
}
