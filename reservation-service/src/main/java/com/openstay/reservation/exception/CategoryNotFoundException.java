package com.openstay.reservation.exception;

import com.openstay.common.exception.ResourceNotFoundException;

public class CategoryNotFoundException extends ResourceNotFoundException {

    public CategoryNotFoundException(String label) {
        super(String.format("No room category matches '%s'", label), "CATEGORY_NOT_FOUND");
    }
}
