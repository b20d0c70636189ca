package io.arrowsource.formats;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.fields;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;
import org.slf4j.Logger;

/** Naming conventions for loggers and exceptions. */
@AnalyzeClasses(
    packages = "io.arrowsource.formats",
    importOptions = ImportOption.DoNotIncludeTests.class)
public class NamingTest {

  @ArchTest
  static final ArchRule loggersShouldBePrivateStaticFinal =
      fields()
          .that()
          .haveRawType(Logger.class)
          .should()
          .bePrivate()
          .andShould()
          .beStatic()
          .andShould()
          .beFinal()
          .andShould()
          .haveName("logger");

  @ArchTest
  static final ArchRule exceptionsShouldExtendDeserializerException =
      classes()
          .that()
          .haveSimpleNameEndingWith("Exception")
          .and()
          .arePublic()
          .and()
          .doNotHaveSimpleName("DeserializerException")
          .should()
          .beAssignableTo(DeserializerException.class)
          .because("callers catch every decoding failure as DeserializerException");
}
