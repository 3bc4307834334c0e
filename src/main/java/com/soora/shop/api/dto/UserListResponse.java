package com.soora.shop.api.dto;

import java.util.List;

/**
 * One page of users for the admin console.
 *
 * @author Soora Platform Team
 */
public class UserListResponse {

    private List<AdminUserResponse> users;
    private PaginationResponse pagination;

    public UserListResponse() {
    }

    public UserListResponse(List<AdminUserResponse> users, PaginationResponse pagination) {
        this.users = users;
        this.pagination = pagination;
    }

    public List<AdminUserResponse> getUsers() {
        return users;
    }

    public void setUsers(List<AdminUserResponse> users) {
        this.users = users;
    }

    public PaginationResponse getPagination() {
        return pagination;
    }

    public void setPagination(PaginationResponse pagination) {
        this.pagination = pagination;
    }
}
