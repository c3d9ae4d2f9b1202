package info.isaksson.erland.csmap.emitter;

import info.isaksson.erland.csmap.model.CsEnum;
import info.isaksson.erland.csmap.model.CsField;
import info.isaksson.erland.csmap.model.CsMethod;
import info.isaksson.erland.csmap.model.CsModel;
import info.isaksson.erland.csmap.model.CsParam;
import info.isaksson.erland.csmap.model.CsProperty;
import info.isaksson.erland.csmap.model.CsType;
import info.isaksson.erland.csmap.model.CsTypeKind;
import info.isaksson.erland.csmap.model.CsUnit;
import info.isaksson.erland.csmap.model.CsVisibility;
import info.isaksson.erland.csmap.model.DependencyEdge;
import info.isaksson.erland.csmap.model.UnitParseFailure;

import java.util.List;

/** Hand-built models shared by the writer tests. */
final class SampleModels {

    private SampleModels() {}

    static CsMethod method(String name, String returnType, CsVisibility vis, List<CsParam> params, String doc) {
        return new CsMethod(name, returnType, vis, false, false, false, false, false, false, params, doc);
    }

    static CsUnit player() {
        CsType player = new CsType(
                "Player", CsVisibility.PUBLIC, CsTypeKind.CLASS,
                false, false, false, false,
                List.of("MonoBehaviour", "IDamageable"),
                List.of(
                        new CsField("Tag", "string", CsVisibility.PUBLIC, false, false, true, false, "\"Player\""),
                        new CsField("speed", "float", CsVisibility.PRIVATE, false, false, false, true, "5f",
                                "Movement", "Units per second"),
                        new CsField("Lethal", "int", CsVisibility.PROTECTED, true, true, false, false, "0")),
                List.of(new CsProperty("Health", "Health", CsVisibility.PUBLIC, true, false, false)),
                List.of(
                        new CsMethod("Awake", "void", CsVisibility.PROTECTED, false, true, false, false, false, false,
                                List.of(), null),
                        method("TakeDamage", "void", CsVisibility.PUBLIC, List.of(
                                new CsParam("amount", "int", null),
                                new CsParam("kind", "DamageKind", "DamageKind.Physical")), "Applies amount damage."),
                        new CsMethod("Blink", "IEnumerator", CsVisibility.PUBLIC, false, false, false, false, false, true,
                                List.of(new CsParam("seconds", "float", null)), null),
                        new CsMethod("OnHit", "void", CsVisibility.PROTECTED, false, true, false, false, false, false,
                                List.of(), null)),
                List.of(new CsEnum("Mode", CsVisibility.PUBLIC, List.of("Walk", "Run"))),
                "Moves the player.",
                null,
                8);
        CsUnit unit = new CsUnit("Scripts/Player.cs", "Player.cs", "Mini.Gameplay", List.of("UnityEngine"),
                List.of(player), List.of(), "Player controller for the sample scene.", List.of());
        unit.dependencies.add(new DependencyEdge(unit.id, "Health"));
        unit.dependencies.add(new DependencyEdge(unit.id, "IDamageable"));
        return unit;
    }

    static CsUnit health() {
        CsType health = new CsType(
                "Health", CsVisibility.PUBLIC, CsTypeKind.CLASS,
                false, false, false, false,
                List.of(),
                List.of(new CsField("Max", "int", CsVisibility.PUBLIC, false, false, false, false, "100")),
                List.of(),
                List.of(method("Apply", "void", CsVisibility.PUBLIC, List.of(new CsParam("delta", "int", null)), null)),
                List.of(),
                null,
                null,
                3);
        return new CsUnit("Scripts/Health.cs", "Health.cs", "Mini.Gameplay", List.of(),
                List.of(health), List.of(new CsEnum("DamageKind", CsVisibility.PUBLIC, List.of("Physical", "Fire"))),
                null, List.of());
    }

    static CsModel model() {
        CsModel model = new CsModel();
        model.units.add(player());
        model.units.add(health());
        model.dependencyEdges.addAll(model.units.get(0).dependencies);
        model.failures.add(new UnitParseFailure("Scripts/Broken.cs", "IllegalStateException: boom"));
        return model;
    }
}
