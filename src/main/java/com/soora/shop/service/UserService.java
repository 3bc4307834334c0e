package com.soora.shop.service;

import com.soora.shop.api.dto.AdminUserResponse;
import com.soora.shop.api.dto.PaginationResponse;
import com.soora.shop.api.dto.UpdateProfileRequest;
import com.soora.shop.api.dto.UserListResponse;
import com.soora.shop.api.dto.UserProfileResponse;
import com.soora.shop.api.dto.UserTierResponse;
import com.soora.shop.domain.model.CustomerTier;
import com.soora.shop.domain.model.User;
import com.soora.shop.exception.InvalidRequestException;
import com.soora.shop.exception.ResourceNotFoundException;
import com.soora.shop.repository.OrderRepository;
import com.soora.shop.repository.UserOrderCount;
import com.soora.shop.repository.UserRepository;
import com.soora.shop.security.CallerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service for user profiles (caller-facing) and user administration.
 *
 * @author Soora Platform Team
 */
@Service
public class UserService {

    private static final Logger logger = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final OrderRepository orderRepository;

    public UserService(UserRepository userRepository, OrderRepository orderRepository) {
        this.userRepository = userRepository;
        this.orderRepository = orderRepository;
    }

    @Transactional(readOnly = true)
    public UserProfileResponse getProfile(CallerContext caller) {
        return UserProfileResponse.fromEntity(findUser(caller.getUserId()));
    }

    /**
     * Update the caller's name and phone. Null fields keep their current value.
     *
     * @param caller Current caller
     * @param request New values
     * @return Updated profile
     */
    @Transactional
    public UserProfileResponse updateProfile(CallerContext caller, UpdateProfileRequest request) {
        User user = findUser(caller.getUserId());

        if (request.getName() != null) {
            user.setName(request.getName().trim());
        }
        if (request.getPhone() != null) {
            user.setPhone(request.getPhone().trim());
        }

        User saved = userRepository.save(user);
        logger.info("Updated profile for user: {}", saved.getId());
        return UserProfileResponse.fromEntity(saved);
    }

    /**
     * List users newest first, each with the number of orders they placed.
     *
     * @param pageQuery Page window
     * @return One page of users
     */
    @Transactional(readOnly = true)
    public UserListResponse listUsers(PageQuery pageQuery) {
        Page<User> page = userRepository.findAllByOrderByCreatedAtDesc(pageQuery.toPageable());

        Map<String, Long> orderCounts = countOrders(page.getContent());

        List<AdminUserResponse> users = page.getContent().stream()
                .map(user -> AdminUserResponse.fromEntity(user, orderCounts.getOrDefault(user.getId(), 0L)))
                .collect(Collectors.toList());

        logger.debug("Listed {} of {} users", users.size(), page.getTotalElements());
        return new UserListResponse(users, PaginationResponse.of(pageQuery, page.getTotalElements()));
    }

    /**
     * Move a user to another loyalty tier.
     *
     * @param userId Target user
     * @param tierValue Tier name, case-insensitive
     * @return id, email, name and new tier
     * @throws InvalidRequestException if the tier is unknown
     * @throws ResourceNotFoundException if the user does not exist
     */
    @Transactional
    public UserTierResponse updateTier(String userId, String tierValue) {
        CustomerTier tier = parseTier(tierValue);
        User user = findUser(userId);

        CustomerTier previous = user.getTier();
        user.setTier(tier);
        User saved = userRepository.save(user);

        logger.info("Changed tier of user: {} from {} to {}", userId, previous, tier);
        return UserTierResponse.fromEntity(saved);
    }

    private User findUser(String userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    }

    private Map<String, Long> countOrders(List<User> users) {
        if (users.isEmpty()) {
            return Collections.emptyMap();
        }
        List<String> ids = users.stream().map(User::getId).collect(Collectors.toList());
        return orderRepository.countOrdersByUserIds(ids).stream()
                .collect(Collectors.toMap(UserOrderCount::getUserId, UserOrderCount::getOrderCount));
    }

    static CustomerTier parseTier(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("tier", "Tier is required");
        }
        try {
            return CustomerTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("tier", "Unknown tier: " + value);
        }
    }
}
