package info.isaksson.erland.csmap.extract;

import info.isaksson.erland.csmap.io.SourceText;
import info.isaksson.erland.csmap.model.CsField;
import info.isaksson.erland.csmap.model.CsMethod;
import info.isaksson.erland.csmap.model.CsProperty;
import info.isaksson.erland.csmap.model.CsType;
import info.isaksson.erland.csmap.model.CsTypeKind;
import info.isaksson.erland.csmap.model.CsUnit;
import info.isaksson.erland.csmap.model.CsVisibility;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SourceUnitParserTest {

    private static CsUnit parse(String src) {
        return new SourceUnitParser().parse(new SourceText("Test.cs", "Test.cs", src));
    }

    private static CsField field(CsType t, String name) {
        return t.fields.stream().filter(f -> f.name.equals(name)).findFirst().orElse(null);
    }

    private static CsMethod method(CsType t, String name) {
        return t.methods.stream().filter(m -> m.name.equals(name)).findFirst().orElse(null);
    }

    private static CsProperty property(CsType t, String name) {
        return t.properties.stream().filter(p -> p.name.equals(name)).findFirst().orElse(null);
    }

    @Test
    void singleLineClassKeepsPublicFieldOnly() {
        CsUnit unit = parse("public class Foo : Bar { public int X; private int y; }");

        assertEquals(1, unit.types.size());
        CsType foo = unit.types.get(0);
        assertEquals("Foo", foo.name);
        assertEquals(List.of("Bar"), foo.baseTypes);
        assertEquals(1, foo.fields.size());
        CsField x = foo.fields.get(0);
        assertEquals("X", x.name);
        assertEquals("int", x.type);
        assertEquals(CsVisibility.PUBLIC, x.visibility);
        assertNull(field(foo, "y"));
    }

    @Test
    void serializedPrivateFieldIsIncludedWithInspectorLabels() {
        String src = "public class Mover : MonoBehaviour\n"
                + "{\n"
                + "    [Header(\"Movement\")]\n"
                + "    [Tooltip(\"Units per second\")]\n"
                + "    [SerializeField] private float speed = 5f;\n"
                + "    private float hidden;\n"
                + "    [UnityEngine.SerializeField] protected int count;\n"
                + "}\n";
        CsType t = parse(src).types.get(0);

        CsField speed = field(t, "speed");
        assertNotNull(speed);
        assertTrue(speed.isSerialized);
        assertEquals(CsVisibility.PRIVATE, speed.visibility);
        assertEquals("5f", speed.defaultValue);
        assertEquals("Movement", speed.header);
        assertEquals("Units per second", speed.tooltip);

        assertNull(field(t, "hidden"));
        CsField count = field(t, "count");
        assertNotNull(count);
        assertTrue(count.isSerialized);
    }

    @Test
    void constantsAndStaticReadonlySurfaceUnlessPrivate() {
        String src = "class Limits {\n"
                + "    protected const int Max = 10;\n"
                + "    internal static readonly string Name = \"a;b\";\n"
                + "    private const int Secret = 1;\n"
                + "    protected static int NotConstant;\n"
                + "}\n";
        CsType t = parse(src).types.get(0);

        assertTrue(field(t, "Max").isConst);
        assertEquals(CsVisibility.PROTECTED, field(t, "Max").visibility);
        CsField name = field(t, "Name");
        assertTrue(name.isStatic && name.isReadonly);
        assertEquals("\"a;b\"", name.defaultValue);
        assertNull(field(t, "Secret"));
        assertNull(field(t, "NotConstant"));
    }

    @Test
    void propertyAccessorsFollowTheirOwnVisibility() {
        String src = "public class P {\n"
                + "    public int Hp { get; private set; }\n"
                + "    public int Mp { get { return mp; } set { mp = value; } }\n"
                + "    public bool Alive => Hp > 0;\n"
                + "    public static string Label { get; init; }\n"
                + "    private int Hidden { get; set; }\n"
                + "    protected int Prot { get; set; }\n"
                + "    private int mp;\n"
                + "}\n";
        CsType t = parse(src).types.get(0);

        CsProperty hp = property(t, "Hp");
        assertTrue(hp.hasGetter);
        assertFalse(hp.hasSetter);
        CsProperty mp = property(t, "Mp");
        assertTrue(mp.hasGetter && mp.hasSetter);
        CsProperty alive = property(t, "Alive");
        assertTrue(alive.hasGetter);
        assertFalse(alive.hasSetter);
        CsProperty label = property(t, "Label");
        assertTrue(label.isStatic);
        assertTrue(label.hasSetter);
        assertNull(property(t, "Hidden"));
        assertNull(property(t, "Prot"));
    }

    @Test
    void methodPolicyAndModifiers() {
        String src = "public abstract class Enemy : MonoBehaviour\n"
                + "{\n"
                + "    public void Attack(Target target, int damage = 10) { }\n"
                + "    public static async Task<int> LoadAsync(string path) { return 0; }\n"
                + "    public IEnumerator Flash(float t) { yield return null; }\n"
                + "    protected virtual void OnHit() { }\n"
                + "    protected abstract void Think();\n"
                + "    protected override void Awake() { base.Awake(); }\n"
                + "    protected void Helper() { }\n"
                + "    private void Update() { if (x) { Attack(null); } }\n"
                + "    public Enemy() { }\n"
                + "}\n";
        CsType t = parse(src).types.get(0);

        assertTrue(t.isAbstract);
        CsMethod attack = method(t, "Attack");
        assertEquals("void", attack.returnType);
        assertEquals(2, attack.params.size());
        assertEquals("Target", attack.params.get(0).type);
        assertEquals("10", attack.params.get(1).defaultValue);

        CsMethod load = method(t, "LoadAsync");
        assertTrue(load.isStatic);
        assertTrue(load.isAsync);
        assertEquals("Task<int>", load.returnType);

        assertTrue(method(t, "Flash").isCoroutine);
        assertTrue(method(t, "OnHit").isVirtual);
        assertTrue(method(t, "Think").isAbstract);
        assertTrue(method(t, "Awake").isOverride);
        assertNull(method(t, "Helper"));
        assertNull(method(t, "Update"));
        assertNull(method(t, "Enemy"), "constructors are not methods");
    }

    @Test
    void interfaceMembersDefaultToPublic() {
        String src = "public interface IShop\n"
                + "{\n"
                + "    bool Buy(Item item, int qty);\n"
                + "    int Gold { get; }\n"
                + "}\n";
        CsType t = parse(src).types.get(0);
        assertEquals(CsTypeKind.INTERFACE, t.kind);
        assertEquals(CsVisibility.PUBLIC, method(t, "Buy").visibility);
        assertEquals(2, method(t, "Buy").params.size());
        assertTrue(property(t, "Gold").hasGetter);
    }

    @Test
    void nestedTypesAreFlattenedWithoutDuplicatingMembers() {
        String src = "public class Outer\n"
                + "{\n"
                + "    public int OuterField;\n"
                + "    public enum Phase { Idle, Run }\n"
                + "    private enum Hidden { A }\n"
                + "    public class Inner\n"
                + "    {\n"
                + "        public int InnerField;\n"
                + "        public void InnerMethod() { }\n"
                + "    }\n"
                + "    public void OuterMethod() { }\n"
                + "    class Quiet { }\n"
                + "}\n";
        CsUnit unit = parse(src);
        assertEquals(3, unit.types.size());

        CsType outer = unit.types.get(0);
        assertFalse(outer.isNested());
        assertNotNull(field(outer, "OuterField"));
        assertNull(field(outer, "InnerField"));
        assertNotNull(method(outer, "OuterMethod"));
        assertNull(method(outer, "InnerMethod"));
        assertEquals(1, outer.enums.size());
        assertEquals("Phase", outer.enums.get(0).name);
        assertEquals(List.of("Idle", "Run"), outer.enums.get(0).values);

        CsType inner = unit.types.get(1);
        assertEquals("Outer", inner.outerName);
        assertEquals("Outer.Inner", inner.displayName());
        assertNotNull(field(inner, "InnerField"));
        assertNotNull(method(inner, "InnerMethod"));

        CsType quiet = unit.types.get(2);
        assertEquals(CsVisibility.PRIVATE, quiet.visibility);
        assertEquals(List.of("Outer"), unit.primaryTypeNames());
    }

    @Test
    void topLevelTypeWithoutModifierIsInternal() {
        CsType t = parse("class Plain { }").types.get(0);
        assertEquals(CsVisibility.INTERNAL, t.visibility);
    }

    @Test
    void unitLevelFacts() {
        String src = "// Input bindings and rebinding support for the options menu.\n"
                + "#if UNITY_EDITOR\n"
                + "using UnityEditor;\n"
                + "#endif\n"
                + "using UnityEngine;\n"
                + "namespace Game.Input\n"
                + "{\n"
                + "    public enum Device { Keyboard, Pad }\n"
                + "    /// <summary>Reads bindings.</summary>\n"
                + "    public class Bindings { }\n"
                + "}\n";
        CsUnit unit = parse(src);
        assertEquals("Game.Input", unit.namespace);
        assertEquals(List.of("UnityEditor", "UnityEngine"), unit.usings);
        assertTrue(unit.restrictedBuild);
        assertEquals(List.of("UNITY_EDITOR"), unit.restrictedBuildSymbols);
        assertEquals("Input bindings and rebinding support for the options menu.", unit.fileDoc);
        assertEquals(1, unit.topLevelEnums.size());
        assertEquals("Device", unit.topLevelEnums.get(0).name);
        CsType bindings = unit.types.get(0);
        assertEquals("Reads bindings.", bindings.doc);
        assertEquals(9, bindings.declarationLine);
    }

    @Test
    void methodDocComesFromLinesAboveAttributes() {
        String src = "class C\n"
                + "{\n"
                + "\n"
                + "    /// First line.\n"
                + "    /// Second line.\n"
                + "    [A]\n"
                + "    [B(1)]\n"
                + "    [C(\"x\")]\n"
                + "    public void Run() { }\n"
                + "}\n";
        assertEquals("First line. Second line.", method(parse(src).types.get(0), "Run").doc);
    }

    @Test
    void bracesInStringsDoNotBreakBodies() {
        String src = "public class Fmt {\n"
                + "    public string Open = \"{\";\n"
                + "    public void Write() { var s = $\"{{x}}\"; }\n"
                + "    public int After;\n"
                + "}\n";
        CsType t = parse(src).types.get(0);
        assertEquals("\"{\"", field(t, "Open").defaultValue);
        assertNotNull(method(t, "Write"));
        assertNotNull(field(t, "After"));
    }

    @Test
    void unclosedBodyStillYieldsPartialOutput() {
        CsUnit unit = parse("public class Broken {\n    public int A;\n    public void F() {\n");
        CsType t = unit.types.get(0);
        assertNotNull(field(t, "A"));
        assertNotNull(method(t, "F"));
    }

    @Test
    void accessKeywordMayFollowOtherModifiers() {
        String src = "static public class Tools\n"
                + "{\n"
                + "    static public int Count;\n"
                + "    static public void Foo() { }\n"
                + "    override public string ToString() { return \"\"; }\n"
                + "    public static void Bar() { }\n"
                + "}\n";
        CsType t = parse(src).types.get(0);
        assertEquals(CsVisibility.PUBLIC, t.visibility);
        assertTrue(t.isStatic);

        assertEquals(List.of("Foo", "ToString", "Bar"), t.methods.stream().map(m -> m.name).toList());
        for (CsMethod m : t.methods) {
            assertEquals(CsVisibility.PUBLIC, m.visibility, m.name);
        }
        assertTrue(method(t, "Foo").isStatic);
        assertTrue(method(t, "ToString").isOverride);
        assertEquals("string", method(t, "ToString").returnType);

        CsField count = field(t, "Count");
        assertNotNull(count);
        assertEquals(CsVisibility.PUBLIC, count.visibility);
        assertTrue(count.isStatic);
        assertEquals("int", count.type);
    }

    @Test
    void localsInsideMethodBodiesAreNotMembers() {
        CsType log = parse("interface ILog { void Log(string m) { int count = 0; Write(m); } }").types.get(0);
        assertTrue(log.fields.isEmpty());
        assertTrue(log.properties.isEmpty());
        assertEquals(List.of("Log"), log.methods.stream().map(m -> m.name).toList());

        String src = "public class Runner\n"
                + "{\n"
                + "    public void Tick()\n"
                + "    {\n"
                + "        if (ready) { public int Hidden; }\n"
                + "        var speed = 2;\n"
                + "    }\n"
                + "    public int Visible;\n"
                + "}\n";
        CsType runner = parse(src).types.get(0);
        assertNull(field(runner, "Hidden"));
        assertNotNull(field(runner, "Visible"));
        assertEquals(List.of("Tick"), runner.methods.stream().map(m -> m.name).toList());
    }

    @Test
    void byteOrderMarkIsIgnored() {
        CsUnit unit = parse("\uFEFFpublic class Bom { }");
        assertEquals("Bom", unit.types.get(0).name);
    }

    @Test
    void emptySourceYieldsEmptyUnit() {
        CsUnit unit = parse("");
        assertTrue(unit.types.isEmpty());
        assertNull(unit.namespace);
        assertFalse(unit.restrictedBuild);
    }
}
