package info.isaksson.erland.csmap.emitter;

import info.isaksson.erland.csmap.model.CsType;

import java.util.Set;

/**
 * Unity engine naming conventions used by the report writers.
 *
 * <p>Purely lexical: a type counts as a Unity component when one of its declared bases has a
 * Unity base class name, and a method is a lifecycle callback when its name is one the engine
 * invokes by reflection.</p>
 */
public final class UnityConventions {

    private UnityConventions() {}

    public static final Set<String> BASE_CLASSES = Set.of(
            "MonoBehaviour", "NetworkBehaviour", "ScriptableObject", "Editor", "EditorWindow");

    public static final Set<String> LIFECYCLE_CALLBACKS = Set.of(
            "Awake", "Start", "Update", "FixedUpdate", "LateUpdate",
            "OnEnable", "OnDisable", "OnDestroy", "OnGUI",
            "OnTriggerEnter", "OnTriggerExit", "OnTriggerStay",
            "OnTriggerEnter2D", "OnTriggerExit2D", "OnTriggerStay2D",
            "OnCollisionEnter", "OnCollisionExit", "OnCollisionStay",
            "OnCollisionEnter2D", "OnCollisionExit2D", "OnCollisionStay2D",
            "OnMouseDown", "OnMouseUp", "OnMouseEnter", "OnMouseExit", "OnMouseOver", "OnMouseDrag",
            "OnBecameVisible", "OnBecameInvisible",
            "OnApplicationPause", "OnApplicationQuit", "OnApplicationFocus",
            "OnDrawGizmos", "OnDrawGizmosSelected",
            "OnValidate", "Reset",
            "OnAnimatorMove", "OnAnimatorIK",
            "OnRenderObject", "OnWillRenderObject", "OnPreRender", "OnPostRender", "OnRenderImage");

    public static boolean isLifecycleCallback(String methodName) {
        return methodName != null && LIFECYCLE_CALLBACKS.contains(methodName);
    }

    public static boolean isUnityType(CsType type) {
        if (type == null) return false;
        for (String base : type.baseTypes) {
            if (BASE_CLASSES.contains(simpleName(base))) return true;
        }
        return false;
    }

    /** {@code UnityEngine.MonoBehaviour} and {@code Foo<T>} reduce to {@code MonoBehaviour} and {@code Foo}. */
    static String simpleName(String typeExpression) {
        if (typeExpression == null) return "";
        String s = typeExpression.trim();
        int lt = s.indexOf('<');
        if (lt >= 0) s = s.substring(0, lt);
        int dot = s.lastIndexOf('.');
        if (dot >= 0) s = s.substring(dot + 1);
        return s.trim();
    }
}
