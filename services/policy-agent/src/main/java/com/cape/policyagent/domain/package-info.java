/**
 * Application layer of the policy agent.
 *
 * <ul>
 *   <li>{@link com.cape.policyagent.domain.LabelService}: transactional group and object flows over
 *       {@link com.cape.label.LabelEngine}
 *   <li>{@link com.cape.policyagent.domain.GroupLabels} and {@link
 *       com.cape.policyagent.domain.ObjectLabels}: read models returned to the API layer
 * </ul>
 *
 * <p>Depends on {@code cape-label-core} only; never on the {@code api} or {@code infrastructure}
 * packages.
 */
package com.cape.policyagent.domain;
