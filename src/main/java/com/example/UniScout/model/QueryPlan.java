package com.example.UniScout.model;

/**
 * Backend search expressions for one query.
 *
 * @param restricted   expression scoped to the primary allowed domain with a site token
 * @param unrestricted expression for broad web search
 */
public record QueryPlan(String restricted, String unrestricted) {
}
