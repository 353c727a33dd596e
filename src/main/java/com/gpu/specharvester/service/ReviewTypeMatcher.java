package com.gpu.specharvester.service;

/**
 * Decides whether a review sub-page option belongs to a stored review type
 */
public interface ReviewTypeMatcher {

    boolean matches(String reviewType, String optionText);
}
