/**
 * Spring transaction integration: {@link io.clinic.spring.SpringTxContext} and
 * {@link io.clinic.spring.SpringTransactionRunner}.
 */
package io.clinic.spring;
