package architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import finewine.acquisition.compliance.ComplianceCheck;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * 모듈 경계 규칙.
 *
 * <ul>
 *   <li>module-core(domain, port)는 프레임워크에 의존하지 않는다
 *   <li>module-infra는 애플리케이션 계층을 알지 못한다
 *   <li>컴플라이언스 점검 구현체는 {@link ComplianceCheck}를 구현한다
 * </ul>
 */
@Tag("unit")
@DisplayName("모듈 경계 아키텍처 테스트")
class ModuleBoundaryTest {

  private final JavaClasses classes =
      new ClassFileImporter()
          .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
          .importPackages("finewine.acquisition");

  @Nested
  @DisplayName("Core: 프레임워크 독립")
  class CoreIsolation {

    @Test
    @DisplayName("domain/port는 Spring에 의존하지 않는다")
    void coreShouldNotDependOnSpring() {
      noClasses()
          .that()
          .resideInAPackage("finewine.acquisition.domain..")
          .or()
          .resideInAPackage("finewine.acquisition.core.port..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("org.springframework..")
          .because("Core must stay usable without a Spring context")
          .allowEmptyShould(true)
          .check(classes);
    }

    @Test
    @DisplayName("domain/port는 Micrometer, Reactor, resilience4j에 의존하지 않는다")
    void coreShouldNotDependOnInfrastructureLibraries() {
      noClasses()
          .that()
          .resideInAPackage("finewine.acquisition.domain..")
          .or()
          .resideInAPackage("finewine.acquisition.core.port..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("io.micrometer..", "reactor..", "io.github.resilience4j..")
          .allowEmptyShould(true)
          .check(classes);
    }

    @Test
    @DisplayName("domain은 infrastructure 구현을 참조하지 않는다")
    void domainShouldNotDependOnInfrastructure() {
      noClasses()
          .that()
          .resideInAPackage("finewine.acquisition.domain..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("finewine.acquisition.infrastructure..")
          .allowEmptyShould(true)
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Infra: 애플리케이션 계층 비의존")
  class InfraIsolation {

    @Test
    @DisplayName("infrastructure는 orchestrator/monitor/compliance/config를 참조하지 않는다")
    void infraShouldNotDependOnApplication() {
      noClasses()
          .that()
          .resideInAPackage("finewine.acquisition.infrastructure..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "finewine.acquisition.orchestrator..",
              "finewine.acquisition.monitor..",
              "finewine.acquisition.compliance..",
              "finewine.acquisition.config..",
              "finewine.acquisition.status..",
              "finewine.acquisition.source..",
              "finewine.acquisition.lifecycle..")
          .allowEmptyShould(true)
          .check(classes);
    }
  }

  @Nested
  @DisplayName("Compliance 점검 규약")
  class ComplianceChecks {

    @Test
    @DisplayName("*Check 클래스는 ComplianceCheck를 구현한다")
    void checksImplementContract() {
      classes()
          .that()
          .resideInAPackage("finewine.acquisition.compliance.check..")
          .and()
          .haveSimpleNameEndingWith("Check")
          .should()
          .implement(ComplianceCheck.class)
          .check(classes);
    }

    @Test
    @DisplayName("점검 구현체는 스케줄러를 직접 참조하지 않는다")
    void checksShouldNotDependOnScheduler() {
      noClasses()
          .that()
          .resideInAPackage("finewine.acquisition.compliance.check..")
          .should()
          .dependOnClassesThat()
          .haveSimpleName("ComplianceScheduler")
          .check(classes);
    }
  }
}
