package com.soora.shop.service;

import com.soora.shop.api.dto.AddressRequest;
import com.soora.shop.api.dto.AddressResponse;
import com.soora.shop.domain.model.Address;
import com.soora.shop.exception.ResourceNotFoundException;
import com.soora.shop.repository.AddressRepository;
import com.soora.shop.repository.UserRepository;
import com.soora.shop.security.AccessPolicy;
import com.soora.shop.security.CallerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for the caller's address book.
 *
 * Default address handling: the owning user row is locked, then the previous default is
 * cleared and the new one written, all in one transaction. Concurrent default changes for
 * the same user queue on the lock, so a user never ends up with two defaults.
 *
 * @author Soora Platform Team
 */
@Service
public class AddressService {

    private static final Logger logger = LoggerFactory.getLogger(AddressService.class);

    private static final String RESOURCE = "Address";

    private final AddressRepository addressRepository;
    private final UserRepository userRepository;

    public AddressService(AddressRepository addressRepository, UserRepository userRepository) {
        this.addressRepository = addressRepository;
        this.userRepository = userRepository;
    }

    /**
     * List the caller's addresses, default first.
     */
    @Transactional(readOnly = true)
    public List<AddressResponse> listAddresses(CallerContext caller) {
        return addressRepository.findByUserIdOrderByIsDefaultDescCreatedAtAsc(caller.getUserId()).stream()
                .map(AddressResponse::fromEntity)
                .collect(Collectors.toList());
    }

    /**
     * Create an address for the caller.
     *
     * @param caller Current caller
     * @param request Validated address fields
     * @return Saved address
     * @throws ResourceNotFoundException if a default address is requested for a caller without a user row
     */
    @Transactional
    public AddressResponse createAddress(CallerContext caller, AddressRequest request) {
        boolean makeDefault = Boolean.TRUE.equals(request.getIsDefault());

        if (makeDefault) {
            lockOwner(caller);
            int cleared = addressRepository.clearDefaultForUser(caller.getUserId());
            logger.debug("Cleared default flag on {} addresses of user: {}", cleared, caller.getUserId());
        }

        Address address = Address.builder()
                .userId(caller.getUserId())
                .type(request.getType())
                .name(request.getName())
                .street(request.getStreet())
                .unit(request.getUnit())
                .building(request.getBuilding())
                .postalCode(request.getPostalCode())
                .district(request.getDistrict())
                .isDefault(makeDefault)
                .deliveryNotes(request.getDeliveryNotes())
                .build();

        Address saved = addressRepository.save(address);
        logger.info("Created address: {} for user: {} (default={})", saved.getId(), caller.getUserId(), makeDefault);
        return AddressResponse.fromEntity(saved);
    }

    /**
     * Update one of the caller's addresses. Only non-null fields are written.
     *
     * @param caller Current caller
     * @param addressId Address to update
     * @param request Fields to change
     * @return Updated address
     * @throws ResourceNotFoundException if the address is missing or owned by someone else
     */
    @Transactional
    public AddressResponse updateAddress(CallerContext caller, String addressId, AddressRequest request) {
        Address address = findOwnedAddress(caller, addressId);

        if (Boolean.TRUE.equals(request.getIsDefault())) {
            lockOwner(caller);
            // Bulk update clears the persistence context; the save below merges the detached row
            addressRepository.clearDefaultForUserExcept(caller.getUserId(), addressId);
        }

        applyChanges(address, request);

        Address saved = addressRepository.save(address);
        logger.info("Updated address: {} for user: {}", addressId, caller.getUserId());
        return AddressResponse.fromEntity(saved);
    }

    /**
     * Delete one of the caller's addresses.
     *
     * @throws ResourceNotFoundException if the address is missing or owned by someone else
     */
    @Transactional
    public void deleteAddress(CallerContext caller, String addressId) {
        Address address = findOwnedAddress(caller, addressId);
        addressRepository.delete(address);
        logger.info("Deleted address: {} for user: {}", addressId, caller.getUserId());
    }

    private Address findOwnedAddress(CallerContext caller, String addressId) {
        Address address = addressRepository.findById(addressId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE, addressId));
        AccessPolicy.requireOwner(caller, address);
        return address;
    }

    private void lockOwner(CallerContext caller) {
        userRepository.findByIdForUpdate(caller.getUserId())
                .orElseThrow(() -> new ResourceNotFoundException("User", caller.getUserId()));
    }

    private void applyChanges(Address address, AddressRequest request) {
        if (request.getType() != null) {
            address.setType(request.getType());
        }
        if (request.getName() != null) {
            address.setName(request.getName());
        }
        if (request.getStreet() != null) {
            address.setStreet(request.getStreet());
        }
        if (request.getUnit() != null) {
            address.setUnit(request.getUnit());
        }
        if (request.getBuilding() != null) {
            address.setBuilding(request.getBuilding());
        }
        if (request.getPostalCode() != null) {
            address.setPostalCode(request.getPostalCode());
        }
        if (request.getDistrict() != null) {
            address.setDistrict(request.getDistrict());
        }
        if (request.getIsDefault() != null) {
            address.setIsDefault(request.getIsDefault());
        }
        if (request.getDeliveryNotes() != null) {
            address.setDeliveryNotes(request.getDeliveryNotes());
        }
    }
}
