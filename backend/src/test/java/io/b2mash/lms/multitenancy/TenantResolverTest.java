package io.b2mash.lms.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.lms.exception.InvalidStateException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.mock.web.MockHttpServletRequest;

class TenantResolverTest {

  private final TenantResolver resolver = new TenantResolver();

  @Test
  void resolve_returnsHeaderValue() {
    var request = new MockHttpServletRequest();
    request.addHeader(TenantResolver.TENANT_HEADER, "Acme-Corp");

    assertThat(resolver.resolve(request)).isEqualTo("Acme-Corp");
  }

  @Test
  void resolve_missingHeader_throwsBadRequest() {
    var request = new MockHttpServletRequest();

    assertThatThrownBy(() -> resolver.resolve(request))
        .isInstanceOf(InvalidStateException.class)
        .satisfies(e -> assertThat(((InvalidStateException) e).getStatusCode().value()).isEqualTo(400));
  }

  @ParameterizedTest
  @ValueSource(strings = {"acme corp", "acme.corp", "acme/../x", "ténant", "acme;drop"})
  void resolve_rejectsValuesOutsidePattern(String value) {
    assertThatThrownBy(() -> resolver.resolve(value)).isInstanceOf(InvalidStateException.class);
  }

  @ParameterizedTest
  @ValueSource(strings = {" acme", "acme ", "\tacme"})
  void resolve_surroundingWhitespace_isRejected(String value) {
    var request = new MockHttpServletRequest();
    request.addHeader(TenantResolver.TENANT_HEADER, value);

    assertThatThrownBy(() -> resolver.resolve(request)).isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> resolver.resolve(value)).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void resolve_blankValue_throwsBadRequest() {
    assertThatThrownBy(() -> resolver.resolve("   ")).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void sanitize_lowercasesAndReplacesHyphens() {
    assertThat(TenantResolver.sanitize("Acme-Corp_EU")).isEqualTo("acme_corp_eu");
  }

  @ParameterizedTest
  @ValueSource(strings = {"acme", "ACME", "a-b-c", "Mixed_Case-01", "___", "-"})
  void sanitize_isIdempotent(String tenantId) {
    String once = TenantResolver.sanitize(tenantId);

    assertThat(TenantResolver.sanitize(once)).isEqualTo(once);
  }

  @Test
  void sameTenant_comparesSanitizedForms() {
    assertThat(TenantResolver.sameTenant("acme-corp", "ACME_CORP")).isTrue();
    assertThat(TenantResolver.sameTenant("acme", "other")).isFalse();
    assertThat(TenantResolver.sameTenant(null, "acme")).isFalse();
  }

  @Test
  void isValid_matchesHeaderPattern() {
    assertThat(TenantResolver.isValid("tenant_01-a")).isTrue();
    assertThat(TenantResolver.isValid("")).isFalse();
    assertThat(TenantResolver.isValid(null)).isFalse();
  }

  @Test
  void unboundTenantIdentifier_isNeverAValidTenant() {
    assertThat(TenantResolver.isValid(TenantContext.NO_TENANT)).isFalse();
    assertThat(new TenantIdentifierResolver().resolveCurrentTenantIdentifier())
        .isEqualTo(TenantContext.NO_TENANT);
  }
}
