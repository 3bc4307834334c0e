package com.soora.shop.api.dto;

import com.soora.shop.domain.model.Review;
import com.soora.shop.domain.model.User;

import java.time.Instant;

/**
 * Published review as shown on a product page.
 * The reviewer is reduced to name and email.
 *
 * @author Soora Platform Team
 */
public class ReviewResponse {

    private String id;
    private Integer rating;
    private String comment;
    private Instant createdAt;
    private Reviewer user;

    public ReviewResponse() {
    }

    public static ReviewResponse fromEntity(Review review) {
        ReviewResponse response = new ReviewResponse();
        response.setId(review.getId());
        response.setRating(review.getRating());
        response.setComment(review.getComment());
        response.setCreatedAt(review.getCreatedAt());

        User reviewer = review.getUser();
        if (reviewer != null) {
            response.setUser(new Reviewer(reviewer.getName(), reviewer.getEmail()));
        }
        return response;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Integer getRating() {
        return rating;
    }

    public void setRating(Integer rating) {
        this.rating = rating;
    }

    public String getComment() {
        return comment;
    }

    public void setComment(String comment) {
        this.comment = comment;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Reviewer getUser() {
        return user;
    }

    public void setUser(Reviewer user) {
        this.user = user;
    }

    public static class Reviewer {
        private String name;
        private String email;

        public Reviewer() {
        }

        public Reviewer(String name, String email) {
            this.name = name;
            this.email = email;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }
    }
}
