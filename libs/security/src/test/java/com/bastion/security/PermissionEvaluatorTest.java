package com.bastion.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bastion.security.testing.TestCallerContextFactory;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PermissionEvaluator")
class PermissionEvaluatorTest {

    private static final String INSTANCE = TestCallerContextFactory.INSTANCE_ID;

    @Nested
    @DisplayName("instance scope")
    class InstanceScope {

        @Test
        @DisplayName("IAM owner may read and write instance policies")
        void iamOwnerWritesPolicy() {
            var caller = TestCallerContextFactory.iamOwner();
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.IAM_POLICY_WRITE, ResourceScope.instance(INSTANCE))).isTrue();
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.IAM_POLICY_READ, ResourceScope.instance(INSTANCE))).isTrue();
        }

        @Test
        @DisplayName("org owner is denied instance policies")
        void orgOwnerDeniedInstancePolicy() {
            var caller = TestCallerContextFactory.orgOwner("org-1");
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.IAM_POLICY_READ, ResourceScope.instance(INSTANCE))).isFalse();
        }

        @Test
        @DisplayName("instance membership of another instance does not reach this instance")
        void otherInstanceMembership() {
            var caller = TestCallerContextFactory.create("u", "org-1", List.of(
                    new RoleMembership(Role.IAM_OWNER, ResourceScope.instance("other-instance"))));
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.IAM_POLICY_READ, ResourceScope.instance(INSTANCE))).isFalse();
        }

        @Test
        @DisplayName("instance membership of another instance reaches no organization, project or project grant")
        void otherInstanceMembershipReachesNothingBelow() {
            var caller = TestCallerContextFactory.create("u", "org-1", List.of(
                    new RoleMembership(Role.IAM_OWNER, ResourceScope.instance("other-instance"))));
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.USER_GRANT_READ, ResourceScope.organization("org-1"))).isFalse();
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.USER_GRANT_WRITE, ResourceScope.project("org-1", "p-1"))).isFalse();
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.USER_GRANT_DELETE, ResourceScope.projectGrant("org-1", "pg-1"))).isFalse();
        }

        @Test
        @DisplayName("IAM owner reaches every organization through the hierarchy")
        void iamOwnerReachesOrganizations() {
            var caller = TestCallerContextFactory.iamOwner();
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.USER_GRANT_WRITE, ResourceScope.organization("any-org"))).isTrue();
        }
    }

    @Nested
    @DisplayName("organization scope")
    class OrganizationScope {

        @Test
        @DisplayName("org owner may write grants on projects of the organization")
        void orgOwnerWritesProjectGrants() {
            var caller = TestCallerContextFactory.orgOwner("org-1");
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.USER_GRANT_WRITE, ResourceScope.project("org-1", "p-1"))).isTrue();
        }

        @Test
        @DisplayName("org owner is denied in another organization")
        void orgOwnerDeniedElsewhere() {
            var caller = TestCallerContextFactory.orgOwner("org-1");
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.USER_GRANT_WRITE, ResourceScope.organization("org-2"))).isFalse();
        }
    }

    @Nested
    @DisplayName("project scope")
    class ProjectScope {

        @Test
        @DisplayName("project owner may write grants on the owned project only")
        void projectOwnerOwnProject() {
            var caller = TestCallerContextFactory.projectOwner("org-1", "p-1");
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.USER_GRANT_WRITE, ResourceScope.project("org-1", "p-1"))).isTrue();
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.USER_GRANT_WRITE, ResourceScope.project("org-1", "p-2"))).isFalse();
        }

        @Test
        @DisplayName("project owner does not reach the whole organization")
        void projectOwnerNotOrgWide() {
            var caller = TestCallerContextFactory.projectOwner("org-1", "p-1");
            assertThat(PermissionEvaluator.isAllowed(
                    caller, Permission.USER_GRANT_WRITE, ResourceScope.organization("org-1"))).isFalse();
        }
    }

    @Nested
    @DisplayName("check()")
    class Check {

        @Test
        @DisplayName("login client is denied every management permission")
        void loginClientDenied() {
            var caller = TestCallerContextFactory.loginClient();
            for (Permission permission : Permission.values()) {
                assertThatThrownBy(() -> PermissionEvaluator.check(
                        caller, permission, ResourceScope.organization(TestCallerContextFactory.ORG_ID)))
                        .isInstanceOf(PermissionDeniedException.class)
                        .hasMessageContaining(permission.value());
            }
        }

        @Test
        @DisplayName("passes silently when allowed")
        void passes() {
            var caller = TestCallerContextFactory.iamOwner();
            assertThatCode(() -> PermissionEvaluator.check(
                    caller, Permission.IAM_POLICY_WRITE, ResourceScope.instance(INSTANCE)))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("null arguments are denied")
        void nullsDenied() {
            assertThat(PermissionEvaluator.isAllowed(
                    null, Permission.POLICY_READ, ResourceScope.instance(INSTANCE))).isFalse();
        }
    }
}
